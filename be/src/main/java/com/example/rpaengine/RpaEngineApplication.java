package com.example.rpaengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RpaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RpaEngineApplication.class, args);
    }
}
