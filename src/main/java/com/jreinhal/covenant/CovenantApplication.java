package com.jreinhal.covenant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CovenantApplication {

    public static void main(String[] args) {
        SpringApplication.run(CovenantApplication.class, args);
    }
}
