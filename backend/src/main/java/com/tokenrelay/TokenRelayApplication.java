package com.tokenrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TokenRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenRelayApplication.class, args);
    }
}
