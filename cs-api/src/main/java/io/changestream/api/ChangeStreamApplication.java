package io.changestream.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.changestream")
@ConfigurationPropertiesScan
@EnableScheduling
public class ChangeStreamApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChangeStreamApplication.class, args);
    }
}
