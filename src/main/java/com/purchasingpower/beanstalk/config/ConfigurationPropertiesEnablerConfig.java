package com.purchasingpower.beanstalk.config;

import com.purchasingpower.beanstalk.configuration.BeanstalkProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes bound from application.yml.
 *
 * <ul>
 *   <li>{@link BeanstalkProperties} - account id, default region and solution stacks
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    BeanstalkProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
    // Spring instantiates and binds the classes listed in @EnableConfigurationProperties.
}
