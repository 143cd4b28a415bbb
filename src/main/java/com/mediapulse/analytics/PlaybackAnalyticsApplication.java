package com.mediapulse.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlaybackAnalyticsApplication {
    public static void main(String[] args) {
        SpringApplication.run(PlaybackAnalyticsApplication.class, args);
    }
}
