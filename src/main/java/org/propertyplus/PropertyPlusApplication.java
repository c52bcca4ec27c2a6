package org.propertyplus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PropertyPlusApplication {
    public static void main(String[] args) {
        SpringApplication.run(PropertyPlusApplication.class, args);
    }
}
