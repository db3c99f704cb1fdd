package com.slapulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlaPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlaPulseApplication.class, args);
    }
}
