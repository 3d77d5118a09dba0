package com.example.smartparkinggate;

import com.example.smartparkinggate.config.ParkingProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Smart Parking Gate API",
                version = "1.0",
                description = "REST API that reads licence plates from gate camera captures and tracks parking lot occupancy.",
                contact = @Contact(name = "Smart Parking Gate")))
@SpringBootApplication
@EnableConfigurationProperties(ParkingProperties.class)
public class SmartParkingGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartParkingGateApplication.class, args);
    }
}
