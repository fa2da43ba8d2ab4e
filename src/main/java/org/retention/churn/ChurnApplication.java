package org.retention.churn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChurnApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChurnApplication.class, args);
  }

}
