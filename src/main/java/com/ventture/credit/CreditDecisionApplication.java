package com.ventture.credit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CreditDecisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditDecisionApplication.class, args);
    }
}
