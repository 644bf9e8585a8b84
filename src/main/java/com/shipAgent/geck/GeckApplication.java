package com.shipAgent.geck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GeckApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeckApplication.class, args);
    }
}
