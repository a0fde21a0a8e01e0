package com.eainde.forecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastAgentApplication.class, args);
    }
}
