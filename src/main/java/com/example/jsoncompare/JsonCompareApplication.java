package com.example.jsoncompare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JsonCompareApplication {
    public static void main(String[] args) {
        SpringApplication.run(JsonCompareApplication.class, args);
    }
}
