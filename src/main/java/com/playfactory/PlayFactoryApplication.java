package com.playfactory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlayFactoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlayFactoryApplication.class, args);
    }
}
