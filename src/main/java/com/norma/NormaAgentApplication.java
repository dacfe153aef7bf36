package com.norma;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NormaAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(NormaAgentApplication.class, args);
    }
}
