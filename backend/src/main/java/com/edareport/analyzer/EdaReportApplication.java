package com.edareport.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdaReportApplication {

  public static void main(String[] args) {
    SpringApplication.run(EdaReportApplication.class, args);
  }
}
