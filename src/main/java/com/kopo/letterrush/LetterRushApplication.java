package com.kopo.letterrush;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LetterRushApplication {

    public static void main(String[] args) {
        SpringApplication.run(LetterRushApplication.class, args);
    }
}
