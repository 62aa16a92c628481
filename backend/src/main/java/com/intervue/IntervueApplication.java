package com.intervue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntervueApplication {
    public static void main(String[] args) {
        SpringApplication.run(IntervueApplication.class, args);
    }
}
