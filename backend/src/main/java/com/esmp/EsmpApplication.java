package com.esmp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EsmpApplication {

    public static void main(String[] args) {
        SpringApplication.run(EsmpApplication.class, args);
    }
}
