package de.seuhd.balizas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main class to start the V16 beacon situation report.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@ComponentScan(basePackages = "de.seuhd.balizas")
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
