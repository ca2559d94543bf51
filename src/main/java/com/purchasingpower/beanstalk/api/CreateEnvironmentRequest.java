package com.purchasingpower.beanstalk.api;

import com.purchasingpower.beanstalk.core.Tag;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Create environment request. The application name comes from the path.
 *
 * @since 1.0.0
 */
@Data
public class CreateEnvironmentRequest {

    private String environmentName;
    private String solutionStackName;
    private List<Tag> tags = new ArrayList<>();
}
