package eu.devmetrics.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DevMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DevMetricsApplication.class, args);
    }
}
