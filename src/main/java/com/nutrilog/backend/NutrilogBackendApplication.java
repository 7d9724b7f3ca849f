package com.nutrilog.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NutrilogBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(NutrilogBackendApplication.class, args);
    }
}
