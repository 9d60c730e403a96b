package ru.kfl.leasingsync.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeasingSyncGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeasingSyncGatewayApplication.class, args);
    }
}
