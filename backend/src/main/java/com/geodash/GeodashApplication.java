package com.geodash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GeodashApplication {
    public static void main(String[] args) {
        SpringApplication.run(GeodashApplication.class, args);
    }
}
