package com.github.spud.sample.ai.pollwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PollWatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(PollWatchApplication.class, args);
  }

}
