package com.purchasingpower.beanstalk.core;

import com.purchasingpower.beanstalk.exception.DuplicateResourceException;
import com.purchasingpower.beanstalk.util.ResourceArnBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An Elastic Beanstalk application and the environments it owns.
 *
 * <p>Environment names are unique within an application. Environments are kept
 * in creation order and are never removed.
 * Applications and their environments are created through {@link ApplicationRegistry}.
 *
 * @since 1.0.0
 */
public class Application {

    private final ApplicationRegistry registry;
    private final String name;
    private final Map<String, Environment> environments = new LinkedHashMap<>();

    Application(ApplicationRegistry registry, String name) {
        this.registry = registry;
        this.name = name;
    }

    /**
     * Create an environment owned by this application.
     *
     * @throws DuplicateResourceException if the name is already used in this application
     */
    Environment createEnvironment(String environmentName, String solutionStackName, Collection<Tag> tags) {
        if (environments.containsKey(environmentName)) {
            throw new DuplicateResourceException(
                "Environment " + environmentName + " already exists in application " + name + ".",
                environmentName
            );
        }

        Environment environment = new Environment(this, environmentName, solutionStackName, tags);
        environments.put(environmentName, environment);
        return environment;
    }

    public String getName() {
        return name;
    }

    public String getRegion() {
        return registry.getRegion();
    }

    public String getAccountId() {
        return registry.getAccountId();
    }

    public String getArn() {
        return ResourceArnBuilder.build(getRegion(), getAccountId(), ResourceArnBuilder.APPLICATION, name);
    }

    /**
     * Environments in creation order.
     */
    public List<Environment> getEnvironments() {
        return new ArrayList<>(environments.values());
    }

    @Override
    public String toString() {
        return "Application{" + name + "}";
    }
}
