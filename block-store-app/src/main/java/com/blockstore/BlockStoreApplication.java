package com.blockstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlockStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlockStoreApplication.class, args);
    }
}
