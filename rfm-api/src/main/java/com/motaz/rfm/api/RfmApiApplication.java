package com.motaz.rfm.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication(scanBasePackages = {"com.motaz.rfm.api", "com.motaz.rfm.training.service"})
public class RfmApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RfmApiApplication.class, args);
    }

}
