package com.mk.fx.qa.traffic.generator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrafficGeneratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(TrafficGeneratorApplication.class, args);
  }
}
