package com.wildvision.observations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WildvisionObservationsApplication {

    public static void main(String[] args) {
        SpringApplication.run(WildvisionObservationsApplication.class, args);
    }
}
