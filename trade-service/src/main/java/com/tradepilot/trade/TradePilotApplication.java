package com.tradepilot.trade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradePilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradePilotApplication.class, args);
    }
}
