package com.tabrelay.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * TabRelay broker entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.tabrelay")
public class TabRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TabRelayApplication.class, args);
    }
}
