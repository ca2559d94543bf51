package com.purchasingpower.beanstalk.api;

import lombok.Data;

/**
 * Create application request.
 *
 * @since 1.0.0
 */
@Data
public class CreateApplicationRequest {

    private String applicationName;
}
