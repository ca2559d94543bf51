package com.purchasingpower.beanstalk.core;

/**
 * A resource tag. Keys are unique within a resource's tag list.
 */
public record Tag(
        String key,
        String value
) {
}
