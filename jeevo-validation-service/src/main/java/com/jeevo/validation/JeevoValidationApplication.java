package com.jeevo.validation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JeevoValidationApplication {

    public static void main(String[] args) {
        SpringApplication.run(JeevoValidationApplication.class, args);
    }
}
