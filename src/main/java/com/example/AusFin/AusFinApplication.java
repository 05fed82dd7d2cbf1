package com.example.AusFin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AusFinApplication {

    public static void main(String[] args) {
        SpringApplication.run(AusFinApplication.class, args);
    }
}
