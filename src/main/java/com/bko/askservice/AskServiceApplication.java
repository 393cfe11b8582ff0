package com.bko.askservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AskServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AskServiceApplication.class, args);
    }
}
