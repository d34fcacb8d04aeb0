package com.codeheadsystems.kastell.springboot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The type Kastell test application.
 */
@SpringBootApplication
public class KastellTestApplication {

  public static void main(String[] args) {
    SpringApplication.run(KastellTestApplication.class, args);
  }
}
