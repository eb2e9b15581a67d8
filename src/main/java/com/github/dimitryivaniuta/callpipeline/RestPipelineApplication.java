package com.github.dimitryivaniuta.callpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RestPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RestPipelineApplication.class, args);
    }
}
