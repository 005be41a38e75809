package com.flagship.topup_gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TopupGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TopupGatewayApplication.class, args);
    }
}
