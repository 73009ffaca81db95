package com.transit.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TransitIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(TransitIngestApplication.class, args);
  }
}
