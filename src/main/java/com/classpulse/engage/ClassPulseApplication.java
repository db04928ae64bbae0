package com.classpulse.engage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ClassPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClassPulseApplication.class, args);
    }
}
