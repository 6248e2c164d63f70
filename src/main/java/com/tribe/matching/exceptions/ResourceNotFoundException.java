package com.tribe.matching.exceptions;

import lombok.Getter;

/**
 * Thrown when a single-target request references an unknown user or tribe.
 * Batch requests report missing ids per item instead.
 */
@Getter
public class ResourceNotFoundException extends BadRequestException {
    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
