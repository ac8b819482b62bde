package com.capacityforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CapacityForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(CapacityForecastApplication.class, args);
    }
}
