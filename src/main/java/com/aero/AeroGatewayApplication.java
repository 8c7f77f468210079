package com.aero;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Aero - multi-provider text generation gateway.
 */
@SpringBootApplication
public class AeroGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AeroGatewayApplication.class, args);
    }
}
