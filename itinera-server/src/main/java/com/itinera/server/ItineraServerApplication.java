package com.itinera.server;

import com.itinera.common.properties.AiProperties;
import com.itinera.common.properties.PlannerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AiProperties.class, PlannerProperties.class})
public class ItineraServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ItineraServerApplication.class, args);
    }
}
