package com.manufacturing.semanticlayer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SemanticLayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SemanticLayerApplication.class, args);
    }
}
