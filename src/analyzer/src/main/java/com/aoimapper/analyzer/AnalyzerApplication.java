package com.aoimapper.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AnalyzerApplication {
  // Main entrypoint: boots Spring and exposes the AOI analysis endpoint.
  public static void main(String[] args) {
    SpringApplication.run(AnalyzerApplication.class, args);
  }
}
