package com.purchasingpower.beanstalk.api;

import com.purchasingpower.beanstalk.core.Application;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Application as rendered by DescribeApplications and CreateApplication.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationDescription {

    private String applicationName;
    private String applicationArn;

    public static ApplicationDescription from(Application application) {
        return ApplicationDescription.builder()
            .applicationName(application.getName())
            .applicationArn(application.getArn())
            .build();
    }
}
