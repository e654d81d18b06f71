package com.scholary.audiobook.enhancer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AudiobookEnhancerApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudiobookEnhancerApplication.class, args);
  }
}
