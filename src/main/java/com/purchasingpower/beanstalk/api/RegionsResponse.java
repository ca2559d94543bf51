package com.purchasingpower.beanstalk.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Regions with a live registry.
 *
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegionsResponse {

    private String defaultRegion;
    private Set<String> regions;
}
