package com.cropcopilot.advisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CropAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CropAdvisorApplication.class, args);
    }
}
