package com.flamingo.ai.argumentation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the argument analysis service. */
@SpringBootApplication
public class ArgumentationApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArgumentationApplication.class, args);
  }
}
