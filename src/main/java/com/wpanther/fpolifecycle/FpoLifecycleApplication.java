package com.wpanther.fpolifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FpoLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(FpoLifecycleApplication.class, args);
    }
}
