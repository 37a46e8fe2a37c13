package com.waste.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class WasteAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(WasteAnomalyApplication.class, args);
    }
}
