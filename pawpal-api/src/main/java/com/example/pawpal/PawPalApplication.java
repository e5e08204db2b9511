package com.example.pawpal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PawPalApplication {

    public static void main(String[] args) {
        SpringApplication.run(PawPalApplication.class, args);
    }
}
