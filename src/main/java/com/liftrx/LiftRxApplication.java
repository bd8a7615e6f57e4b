package com.liftrx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiftRxApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiftRxApplication.class, args);
    }
}
