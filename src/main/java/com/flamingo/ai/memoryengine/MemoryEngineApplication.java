package com.flamingo.ai.memoryengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Tiered memory lifecycle and hybrid retrieval engine. */
@SpringBootApplication
public class MemoryEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(MemoryEngineApplication.class, args);
  }
}
