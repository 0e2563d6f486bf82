package io.intellixity.pagekit.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PagekitExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(PagekitExamplesApplication.class, args);
  }
}
