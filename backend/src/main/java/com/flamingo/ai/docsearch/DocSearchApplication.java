package com.flamingo.ai.docsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the document search backend. */
@SpringBootApplication
public class DocSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocSearchApplication.class, args);
  }
}
