package com.flamingo.ai.checklist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the checklist extraction service. */
@SpringBootApplication
public class ChecklistApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChecklistApplication.class, args);
  }
}
