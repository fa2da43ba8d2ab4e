package org.retention.churn.domain;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/**
 * Format checks shared by the soft (accumulating) and hard (fail-fast) validation paths.
 */
@UtilityClass
public class FieldFormats {

  private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

  // ISO_DATE_TIME covers "2024-01-31T10:15:30", "...Z" and "...+01:00"; ISO_DATE covers "2024-01-31"
  private static final List<DateTimeFormatter> DATE_FORMATS =
      List.of(DateTimeFormatter.ISO_DATE_TIME, DateTimeFormatter.ISO_DATE);

  public static boolean isValidEmail(String email) {
    return email != null && EMAIL.matcher(email).matches();
  }

  /**
   * @return true if the value is an ISO-8601 date or date-time naming a real calendar day
   */
  public static boolean isValidDate(String value) {
    if (StringUtils.isBlank(value)) {
      return false;
    }
    String trimmed = value.trim();
    return DATE_FORMATS.stream().anyMatch(format -> parses(format, trimmed));
  }

  private static boolean parses(DateTimeFormatter format, String value) {
    try {
      format.parse(value);
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }
}
