package com.invdash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InvdashApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvdashApplication.class, args);
    }
}
