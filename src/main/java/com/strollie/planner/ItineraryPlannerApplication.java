package com.strollie.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ItineraryPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ItineraryPlannerApplication.class, args);
    }

}
