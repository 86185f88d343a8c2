package com.skinarb.arb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SkinArbApplication {

    public static void main(String[] args) {
        System.setProperty("java.net.preferIPv4Stack", "true"); // proxy pool is IPv4 only
        SpringApplication.run(SkinArbApplication.class, args);
    }

}
