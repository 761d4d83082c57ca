package com.expektra.opendata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExpektraApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpektraApplication.class, args);
    }
}
