package com.purchasingpower.beanstalk.util;

/**
 * Builds Elastic Beanstalk resource ARNs.
 *
 * <p><b>Format:</b>
 * <pre>
 * arn:aws:elasticbeanstalk:{region}:{accountId}:{resourceType}/{resourcePath}
 * </pre>
 *
 * <p><b>Example:</b>
 * <pre>
 * ResourceArnBuilder.build("us-east-1", "123456789012", "environment", "app1/env1");
 * // arn:aws:elasticbeanstalk:us-east-1:123456789012:environment/app1/env1
 * </pre>
 *
 * <p>Lookups compare ARNs by exact string equality, so the format must not change.
 *
 * @since 1.0.0
 */
public final class ResourceArnBuilder {

    public static final String APPLICATION = "application";
    public static final String ENVIRONMENT = "environment";

    private static final String SERVICE = "elasticbeanstalk";

    private ResourceArnBuilder() {
    }

    public static String build(String region, String accountId, String resourceType, String resourcePath) {
        return String.format("arn:aws:%s:%s:%s:%s/%s", SERVICE, region, accountId, resourceType, resourcePath);
    }

    /**
     * Resource path of an environment: {@code applicationName/environmentName}.
     */
    public static String environmentPath(String applicationName, String environmentName) {
        return applicationName + "/" + environmentName;
    }
}
