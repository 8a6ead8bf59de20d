package com.ai.telehealth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TelehealthApplication {

    public static void main(String[] args) {
        SpringApplication.run(TelehealthApplication.class, args);
    }
}
