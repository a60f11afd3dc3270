package com.commodityforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CommodityForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommodityForecastApplication.class, args);
    }
}
