package com.fuelcopilot.behavior.config;

import com.fuelcopilot.behavior.config.properties.BehaviorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration Properties Enablement
 *
 * <p>Enables {@link BehaviorProperties} (behavior.*) with Bean Validation.
 */
@Configuration
@EnableConfigurationProperties(BehaviorProperties.class)
@Slf4j
public class ConfigurationPropertiesConfig {

    public ConfigurationPropertiesConfig() {
        log.info("Initializing Behavior Service Configuration Properties");
    }
}
