package com.riansoft.pickup_vrp;

import com.riansoft.pickup_vrp.config.RoutingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RoutingProperties.class)
public class PickupVrpApplication {

    public static void main(String[] args) {
        SpringApplication.run(PickupVrpApplication.class, args);
    }
}
