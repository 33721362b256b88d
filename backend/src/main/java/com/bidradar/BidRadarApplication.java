package com.bidradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BidRadarApplication {

  public static void main(String[] args) {
    SpringApplication.run(BidRadarApplication.class, args);
  }
}
