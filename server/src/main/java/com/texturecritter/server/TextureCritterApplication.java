package com.texturecritter.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TextureCritterApplication {

    public static void main(String[] args) {
        SpringApplication.run(TextureCritterApplication.class, args);
    }
}
