package com.callplatform.guardsvc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuardServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardServiceApplication.class, args);
    }
}
