package com.lakehouse.churn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChurnPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChurnPipelineApplication.class, args);
    }
}
