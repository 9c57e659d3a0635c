package com.percussion.scoredb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScoreDbApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScoreDbApplication.class, args);
    }
}
