package com.example.renditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RenditionCacheApplication {
    private static final Logger logger = LoggerFactory.getLogger(
            RenditionCacheApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RenditionCacheApplication.class, args);
        logger.info("Application started");
    }
}
