package com.example.identity_gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@RestController
public class IdentityGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(IdentityGatewayApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "identity-gateway: ok";
  }
}
