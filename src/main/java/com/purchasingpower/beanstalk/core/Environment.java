package com.purchasingpower.beanstalk.core;

import com.purchasingpower.beanstalk.util.ResourceArnBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An Elastic Beanstalk environment, the leaf of the resource hierarchy.
 *
 * <p>An environment belongs to exactly one {@link Application} for its whole lifetime.
 * The application reference is a back-reference only: the application owns the
 * environment, never the other way round. Application name, region and ARN are
 * read through it on every call and never cached.
 *
 * <p>Tags keep insertion order. Overwriting the value of an existing key keeps its
 * position. Tag mutation is driven by the owning registry under its write lock.
 *
 * @since 1.0.0
 */
public class Environment {

    /**
     * Platform ARN resolution is not implemented; every environment reports this value.
     */
    public static final String PLATFORM_ARN_PLACEHOLDER = "TODO";

    private final Application application;
    private final String name;
    private final String solutionStackName;
    private final Map<String, String> tags = new LinkedHashMap<>();

    Environment(Application application, String name, String solutionStackName, Collection<Tag> tags) {
        this.application = application;
        this.name = name;
        this.solutionStackName = solutionStackName;
        if (tags != null) {
            tags.forEach(this::putTag);
        }
    }

    public String getName() {
        return name;
    }

    public String getSolutionStackName() {
        return solutionStackName;
    }

    public String getApplicationName() {
        return application.getName();
    }

    public String getRegion() {
        return application.getRegion();
    }

    public String getArn() {
        return ResourceArnBuilder.build(
            getRegion(),
            application.getAccountId(),
            ResourceArnBuilder.ENVIRONMENT,
            ResourceArnBuilder.environmentPath(getApplicationName(), name)
        );
    }

    // TODO: derive the platform ARN from solutionStackName once platform versions are modelled
    public String getPlatformArn() {
        return PLATFORM_ARN_PLACEHOLDER;
    }

    /**
     * Snapshot of the current tags in insertion order.
     */
    public List<Tag> getTags() {
        List<Tag> snapshot = new ArrayList<>(tags.size());
        tags.forEach((key, value) -> snapshot.add(new Tag(key, value)));
        return snapshot;
    }

    /**
     * Overwrites the value of an existing key in place, otherwise appends.
     */
    void putTag(Tag tag) {
        tags.put(tag.key(), tag.value());
    }

    /**
     * Removes the tag with the given key. Absent keys are ignored.
     */
    void removeTag(String key) {
        tags.remove(key);
    }

    @Override
    public String toString() {
        return "Environment{" + getApplicationName() + "/" + name + "}";
    }
}
