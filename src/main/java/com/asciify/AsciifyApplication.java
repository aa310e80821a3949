package com.asciify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AsciifyApplication {

    public static void main(String[] args) {
        SpringApplication.run(AsciifyApplication.class, args);
    }
}
