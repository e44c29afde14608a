package com.musicinsights.librarysync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LibrarySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibrarySyncApplication.class, args);
    }

}
