package com.purchasingpower.beanstalk.core;


import java.util.List;

/**
 * Tags of a single resource, as returned by {@link ApplicationRegistry#listTags(String)}.
 */
public record ResourceTags(
        String resourceArn,
        List<Tag> tags
) {
}
