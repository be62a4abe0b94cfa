package io.b2mash.chatops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatOpsApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChatOpsApplication.class, args);
  }
}
