package com.grantradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GrantRadarApplication {

  public static void main(String[] args) {
    SpringApplication.run(GrantRadarApplication.class, args);
  }
}
