package com.filenvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FilenEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FilenEngineApplication.class, args);
    }
}
