package com.streamfirst.chainbattles.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainBattlesApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainBattlesApplication.class, args);
    }
}
