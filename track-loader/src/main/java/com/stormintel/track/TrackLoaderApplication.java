package com.stormintel.track;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class TrackLoaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackLoaderApplication.class, args);
    }
}
