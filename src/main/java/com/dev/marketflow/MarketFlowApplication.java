package com.dev.marketflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * This class contains the startup of the application.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MarketFlowApplication {

  public static void main(String[] args) {
    SpringApplication.run(MarketFlowApplication.class, args);
  }

}
