package com.demoBank.ussdPay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UssdPayApplication {

    public static void main(String[] args) {
        SpringApplication.run(UssdPayApplication.class, args);
    }
}
