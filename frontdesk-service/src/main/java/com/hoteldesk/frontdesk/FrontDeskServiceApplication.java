package com.hoteldesk.frontdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.hoteldesk.frontdesk", "com.hoteldesk.common"})
public class FrontDeskServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FrontDeskServiceApplication.class, args);
    }
}
