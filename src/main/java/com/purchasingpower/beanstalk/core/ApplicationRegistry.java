package com.purchasingpower.beanstalk.core;

import com.purchasingpower.beanstalk.exception.DuplicateResourceException;
import com.purchasingpower.beanstalk.exception.ResourceNotFoundException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory Elastic Beanstalk backend for one account and region.
 *
 * <p>Stores applications by name in registration order. Environments are created
 * through their owning application and found again by ARN with a linear scan
 * (application order, then environment order).
 *
 * <p><b>Thread Safety:</b> mutations (create, tag updates, reset) take the write lock,
 * reads take the read lock. Describe results and tag listings are snapshots.
 *
 * @since 1.0.0
 */
@Slf4j
public class ApplicationRegistry {

    @Getter
    private final String accountId;

    @Getter
    private final String region;

    private final List<String> solutionStacks;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Map<String, Application> applications = new LinkedHashMap<>();

    public ApplicationRegistry(String accountId, String region) {
        this(accountId, region, List.of());
    }

    public ApplicationRegistry(String accountId, String region, List<String> solutionStacks) {
        this.accountId = accountId;
        this.region = region;
        this.solutionStacks = solutionStacks != null ? List.copyOf(solutionStacks) : List.of();
    }

    /**
     * Register a new application with no environments.
     *
     * @throws DuplicateResourceException if the name is already registered
     */
    public Application createApplication(String applicationName) {
        lock.writeLock().lock();
        try {
            if (applications.containsKey(applicationName)) {
                throw new DuplicateResourceException(
                    "Application " + applicationName + " already exists.", applicationName);
            }

            Application application = new Application(this, applicationName);
            applications.put(applicationName, application);
            log.info("Created application {} in {}", applicationName, region);
            return application;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * All applications in registration order.
     */
    public List<Application> describeApplications() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(applications.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws ResourceNotFoundException if no application has this name
     */
    public Application getApplication(String applicationName) {
        lock.readLock().lock();
        try {
            return requireApplication(applicationName);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Create an environment under an existing application.
     *
     * @throws ResourceNotFoundException if the application is not registered
     * @throws DuplicateResourceException if the application already has an environment with this name
     * @throws IllegalArgumentException if {@code tags} holds a null tag or key
     */
    public Environment createEnvironment(String applicationName, String environmentName,
                                         String solutionStackName, Collection<Tag> tags) {
        requireValidTags(tags);
        lock.writeLock().lock();
        try {
            Application application = requireApplication(applicationName);
            Environment environment = application.createEnvironment(environmentName, solutionStackName, tags);
            log.info("Created environment {} ({})", environment.getArn(), solutionStackName);
            return environment;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * All environments, ordered by application registration then environment creation.
     */
    public List<Environment> describeEnvironments() {
        lock.readLock().lock();
        try {
            List<Environment> environments = new ArrayList<>();
            for (Application application : applications.values()) {
                environments.addAll(application.getEnvironments());
            }
            return environments;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Find the environment whose ARN equals {@code environmentArn}. The first match in
     * scan order wins.
     *
     * @throws ResourceNotFoundException if no environment matches
     */
    public Environment findEnvironmentByArn(String environmentArn) {
        lock.readLock().lock();
        try {
            return requireEnvironment(environmentArn);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Upsert {@code tagsToAdd} (existing keys keep their position), then remove
     * {@code tagsToRemove}. Removing an absent key is a no-op. Nothing is changed
     * unless the whole request is valid.
     *
     * @throws ResourceNotFoundException if the ARN does not resolve
     * @throws IllegalArgumentException if {@code tagsToAdd} holds a null tag or key
     */
    public void updateTags(String resourceArn, Collection<Tag> tagsToAdd, Collection<String> tagsToRemove) {
        requireValidTags(tagsToAdd);
        lock.writeLock().lock();
        try {
            Environment environment = requireEnvironment(resourceArn);

            if (tagsToAdd != null) {
                tagsToAdd.forEach(environment::putTag);
            }
            if (tagsToRemove != null) {
                tagsToRemove.forEach(environment::removeTag);
            }

            log.debug("Updated tags of {}: +{} -{}", resourceArn,
                tagsToAdd != null ? tagsToAdd.size() : 0,
                tagsToRemove != null ? tagsToRemove.size() : 0);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws ResourceNotFoundException if the ARN does not resolve
     */
    public ResourceTags listTags(String resourceArn) {
        lock.readLock().lock();
        try {
            Environment environment = requireEnvironment(resourceArn);
            return new ResourceTags(resourceArn, environment.getTags());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> listAvailableSolutionStacks() {
        return solutionStacks;
    }

    /**
     * Drop every application and environment. Account and region are kept.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            int dropped = applications.size();
            applications = new LinkedHashMap<>();
            log.info("Reset registry {} ({} applications dropped)", region, dropped);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireValidTags(Collection<Tag> tags) {
        if (tags == null) {
            return;
        }
        for (Tag tag : tags) {
            if (tag == null) {
                throw new IllegalArgumentException("Tag must not be null");
            }
            if (tag.key() == null || tag.key().isBlank()) {
                throw new IllegalArgumentException("Tag key is required");
            }
        }
    }

    private Application requireApplication(String applicationName) {
        Application application = applications.get(applicationName);
        if (application == null) {
            throw new ResourceNotFoundException(
                "No Application named '" + applicationName + "' found.", applicationName);
        }
        return application;
    }

    private Environment requireEnvironment(String resourceArn) {
        return lookupEnvironment(resourceArn)
            .orElseThrow(() -> new ResourceNotFoundException(
                "Resource not found for ARN '" + resourceArn + "'.", resourceArn));
    }

    private Optional<Environment> lookupEnvironment(String resourceArn) {
        for (Application application : applications.values()) {
            for (Environment environment : application.getEnvironments()) {
                if (environment.getArn().equals(resourceArn)) {
                    return Optional.of(environment);
                }
            }
        }
        log.debug("No environment with ARN {} in {}", resourceArn, region);
        return Optional.empty();
    }
}
