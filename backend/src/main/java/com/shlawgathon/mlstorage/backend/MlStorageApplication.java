package com.shlawgathon.mlstorage.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MlStorageApplication {

    public static void main(String[] args) {
        SpringApplication.run(MlStorageApplication.class, args);
    }
}
