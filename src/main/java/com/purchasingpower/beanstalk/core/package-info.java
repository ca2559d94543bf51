/**
 * Elastic Beanstalk resource models.
 *
 * <p>Contains the resource hierarchy and the registry that holds it:
 * <ul>
 *   <li>ApplicationRegistry - per-region store, the only writer of the resources below</li>
 *   <li>Application - owns its environments, unique by name within a registry</li>
 *   <li>Environment - leaf resource with tags, unique by name within its application</li>
 *   <li>Tag - key/value pair</li>
 * </ul>
 *
 * <p>ARNs are never stored. They are computed from names and region on demand.
 *
 * @since 1.0.0
 */
package com.purchasingpower.beanstalk.core;
