package com.perptrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PerpTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerpTraderApplication.class, args);
    }
}
