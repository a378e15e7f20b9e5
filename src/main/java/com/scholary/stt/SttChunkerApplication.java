package com.scholary.stt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class SttChunkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SttChunkerApplication.class, args);
  }
}
