/**
 * REST API layer.
 *
 * <p>Thin adapter over {@link com.purchasingpower.beanstalk.registry.RegistryDirectory}:
 * request parsing, JSON rendering and error mapping only.
 *
 * @since 1.0.0
 */
package com.purchasingpower.beanstalk.api;
