package com.txlens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TxLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(TxLensApplication.class, args);
    }
}
