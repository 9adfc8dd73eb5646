package com.guno.drawimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application - one import run per process start
 */
@SpringBootApplication
public class DrawImportApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DrawImportApplication.class, args)));
    }
}
