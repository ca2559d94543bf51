package com.purchasingpower.beanstalk.exception;

import lombok.Getter;

/**
 * Thrown when an application or environment name is already taken in its scope.
 */
@Getter
public class DuplicateResourceException extends RuntimeException {

    private final String resourceName;

    public DuplicateResourceException(String message, String resourceName) {
        super(message);
        this.resourceName = resourceName;
    }

}
