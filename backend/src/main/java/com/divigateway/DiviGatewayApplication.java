package com.divigateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiviGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiviGatewayApplication.class, args);
    }
}
