package com.yieldbasket.staking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StakingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(StakingServiceApplication.class, args);
    }
}
