package com.purchasingpower.beanstalk.exception;

import lombok.Getter;

/**
 * Thrown when an application name or resource ARN does not resolve.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceId;

    public ResourceNotFoundException(String message, String resourceId) {
        super(message);
        this.resourceId = resourceId;
    }

}
