package com.cropcopilot.advisor.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes that are not
 * themselves components.
 *
 * <ul>
 *   <li>{@link GeminiConfig} - Google Gemini completion settings
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    GeminiConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
