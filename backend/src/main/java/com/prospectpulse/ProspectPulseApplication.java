package com.prospectpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProspectPulseApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProspectPulseApplication.class, args);
  }
}
