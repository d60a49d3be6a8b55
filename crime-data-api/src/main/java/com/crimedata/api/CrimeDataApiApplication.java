package com.crimedata.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class CrimeDataApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrimeDataApiApplication.class, args);
    }
}
