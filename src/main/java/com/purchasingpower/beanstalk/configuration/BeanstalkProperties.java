package com.purchasingpower.beanstalk.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry settings, bound from the {@code beanstalk} namespace in application.yml.
 *
 * <pre>
 * beanstalk:
 *   account-id: "123456789012"
 *   default-region: us-east-1
 *   regions:
 *     - us-east-1
 *     - eu-west-1
 *   solution-stacks:
 *     - "64bit Amazon Linux 2018.03 v4.10.1 running Node.js"
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "beanstalk")
public class BeanstalkProperties {

    /**
     * Account id placed in every ARN.
     */
    @NotBlank(message = "Account id is required")
    private String accountId = "123456789012";

    @NotBlank(message = "Default region is required")
    private String defaultRegion = "us-east-1";

    /**
     * Regions a registry may be created for. Any other region is rejected.
     */
    @NotEmpty(message = "At least one region is required")
    private List<String> regions = new ArrayList<>(List.of("us-east-1"));

    /**
     * Returned by ListAvailableSolutionStacks, in order.
     */
    @NotEmpty
    private List<String> solutionStacks = new ArrayList<>();
}
