package com.storycast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StoryCastApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoryCastApplication.class, args);
    }
}
