package com.memflow.memflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemflowBackendApplication.class, args);
    }
}
