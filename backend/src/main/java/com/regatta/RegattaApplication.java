package com.regatta;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegattaApplication {
    public static void main(String[] args) {
        SpringApplication.run(RegattaApplication.class, args);
    }
}
