package com.mk.fx.qa.process.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProcessSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProcessSyncApplication.class, args);
  }
}
