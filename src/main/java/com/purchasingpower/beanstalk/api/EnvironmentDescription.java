package com.purchasingpower.beanstalk.api;

import com.purchasingpower.beanstalk.core.Environment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Environment as rendered by DescribeEnvironments and CreateEnvironment.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvironmentDescription {

    private String environmentName;
    private String applicationName;
    private String environmentArn;
    private String solutionStackName;
    private String platformArn;

    public static EnvironmentDescription from(Environment environment) {
        return EnvironmentDescription.builder()
            .environmentName(environment.getName())
            .applicationName(environment.getApplicationName())
            .environmentArn(environment.getArn())
            .solutionStackName(environment.getSolutionStackName())
            .platformArn(environment.getPlatformArn())
            .build();
    }
}
