package com.kpiforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KpiForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(KpiForecastApplication.class, args);
    }
}
