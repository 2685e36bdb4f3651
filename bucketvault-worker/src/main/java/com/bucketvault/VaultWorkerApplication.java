package com.bucketvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VaultWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultWorkerApplication.class, args);
    }
}
