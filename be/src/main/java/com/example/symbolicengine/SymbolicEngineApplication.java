package com.example.symbolicengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SymbolicEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SymbolicEngineApplication.class, args);
    }
}
