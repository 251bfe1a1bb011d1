package com.purchasingpower.codesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeSearchApplication.class, args);
    }
}
