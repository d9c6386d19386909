package com.spintax.demo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpintaxEditorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpintaxEditorApplication.class, args);
    }
}
