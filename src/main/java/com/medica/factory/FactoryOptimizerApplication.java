package com.medica.factory;

import com.medica.factory.config.FactoryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FactoryProperties.class)
public class FactoryOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactoryOptimizerApplication.class, args);
    }
}
