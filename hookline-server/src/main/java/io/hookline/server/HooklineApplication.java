package io.hookline.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HooklineApplication {

  public static void main(String[] args) {
    SpringApplication.run(HooklineApplication.class, args);
  }
}
