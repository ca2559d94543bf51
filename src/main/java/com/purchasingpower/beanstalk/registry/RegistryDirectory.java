package com.purchasingpower.beanstalk.registry;

import com.purchasingpower.beanstalk.core.ApplicationRegistry;

import java.util.Set;

/**
 * Maps an account and region to its {@link ApplicationRegistry}.
 *
 * <p>Registries are created lazily on first access and reused afterwards:
 * the same key yields the same instance until {@link #clear()} is called.
 *
 * @since 1.0.0
 */
public interface RegistryDirectory {

    /**
     * Registry for a region under the configured default account.
     *
     * @param region Region name (e.g. "us-east-1")
     * @return Existing or newly created registry
     * @throws IllegalArgumentException if the region is blank or not a known region
     */
    ApplicationRegistry get(String region);

    /**
     * Registry for a region under an explicit account.
     *
     * @param accountId Account id used in ARNs
     * @param region Region name
     * @return Existing or newly created registry
     * @throws IllegalArgumentException if the account is blank, or the region is blank or not a known region
     */
    ApplicationRegistry get(String accountId, String region);

    /**
     * Reset the default-account registry of a region in place. Does not create one.
     */
    void reset(String region);

    /**
     * Reset the registry of an account and region in place. Does not create one.
     */
    void reset(String accountId, String region);

    /**
     * Drop all registries. Subsequent {@code get} calls create fresh instances.
     */
    void clear();

    /**
     * Regions with a registry under the default account.
     */
    Set<String> regions();
}
