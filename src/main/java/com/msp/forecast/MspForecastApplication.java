package com.msp.forecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MspForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(MspForecastApplication.class, args);
    }
}
