package org.retention.churn.rest;

import java.util.List;
import org.retention.churn.domain.CustomerView;

public record CustomerPageResponse(
    List<CustomerView> data,
    String nextCursor,   // null when hasMore=false
    boolean hasMore,
    int limit
) {}
