package com.example.dodge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DodgeRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(DodgeRelayApplication.class, args);
    }
}
