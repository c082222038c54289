package com.quillvault.export.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@org.springframework.boot.context.properties.ConfigurationPropertiesScan
public class ExportSchedulerApplication {
  public static void main(String[] args) {
    SpringApplication.run(ExportSchedulerApplication.class, args);
  }
}
