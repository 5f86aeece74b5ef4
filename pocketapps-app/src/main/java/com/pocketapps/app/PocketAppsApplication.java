package com.pocketapps.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PocketApps automation server entry point.
 */
@SpringBootApplication
public class PocketAppsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PocketAppsApplication.class, args);
    }
}
