package com.foiarelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FoiaRelayApplication {

  public static void main(String[] args) {
    SpringApplication.run(FoiaRelayApplication.class, args);
  }
}
