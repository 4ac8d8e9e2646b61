package com.chapterharvest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChapterHarvestApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChapterHarvestApplication.class, args);
  }
}
