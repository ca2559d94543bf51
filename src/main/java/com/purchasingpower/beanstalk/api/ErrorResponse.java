package com.purchasingpower.beanstalk.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by {@link BeanstalkController}.
 *
 * <p>Codes follow the Elastic Beanstalk API: {@code InvalidParameterValue} and
 * {@code ResourceNotFoundException}.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    public static final String INVALID_PARAMETER_VALUE = "InvalidParameterValue";
    public static final String RESOURCE_NOT_FOUND = "ResourceNotFoundException";
    public static final String INTERNAL_FAILURE = "InternalFailure";

    private boolean success;
    private String code;
    private String error;

    public static ErrorResponse of(String code, String error) {
        return ErrorResponse.builder()
            .success(false)
            .code(code)
            .error(error)
            .build();
    }
}
