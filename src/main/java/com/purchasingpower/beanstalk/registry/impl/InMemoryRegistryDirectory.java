package com.purchasingpower.beanstalk.registry.impl;

import com.purchasingpower.beanstalk.configuration.BeanstalkProperties;
import com.purchasingpower.beanstalk.core.ApplicationRegistry;
import com.purchasingpower.beanstalk.registry.RegistryDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide {@link RegistryDirectory} owned by the Spring context.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InMemoryRegistryDirectory implements RegistryDirectory {

    private final BeanstalkProperties properties;

    private final ConcurrentHashMap<RegistryKey, ApplicationRegistry> registries = new ConcurrentHashMap<>();

    @Override
    public ApplicationRegistry get(String region) {
        return get(properties.getAccountId(), region);
    }

    @Override
    public ApplicationRegistry get(String accountId, String region) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("Account id is required");
        }
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("Region is required");
        }
        if (!properties.getRegions().contains(region)) {
            throw new IllegalArgumentException("Unknown region '" + region + "'");
        }

        return registries.computeIfAbsent(new RegistryKey(accountId, region), key -> {
            log.info("Creating registry for account {} in {}", key.accountId(), key.region());
            return new ApplicationRegistry(key.accountId(), key.region(), properties.getSolutionStacks());
        });
    }

    @Override
    public void reset(String region) {
        reset(properties.getAccountId(), region);
    }

    @Override
    public void reset(String accountId, String region) {
        ApplicationRegistry registry = registries.get(new RegistryKey(accountId, region));
        if (registry != null) {
            registry.reset();
        }
    }

    @Override
    public void clear() {
        log.info("Clearing {} registries", registries.size());
        registries.clear();
    }

    @Override
    public Set<String> regions() {
        Set<String> regions = new TreeSet<>();
        registries.keySet().stream()
            .filter(key -> key.accountId().equals(properties.getAccountId()))
            .forEach(key -> regions.add(key.region()));
        return regions;
    }

    private record RegistryKey(String accountId, String region) {
    }
}
