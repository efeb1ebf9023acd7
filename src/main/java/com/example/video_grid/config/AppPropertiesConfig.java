package com.example.video_grid.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({GridProperties.class, ExtractionProperties.class, FrameCacheProperties.class})
public class AppPropertiesConfig {
}
