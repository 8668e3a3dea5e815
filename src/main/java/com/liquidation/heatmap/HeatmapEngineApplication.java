package com.liquidation.heatmap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HeatmapEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeatmapEngineApplication.class, args);
    }
}
