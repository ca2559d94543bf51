package com.purchasingpower.beanstalk.api;

import com.purchasingpower.beanstalk.configuration.BeanstalkProperties;
import com.purchasingpower.beanstalk.core.Application;
import com.purchasingpower.beanstalk.core.ApplicationRegistry;
import com.purchasingpower.beanstalk.core.Environment;
import com.purchasingpower.beanstalk.core.ResourceTags;
import com.purchasingpower.beanstalk.exception.DuplicateResourceException;
import com.purchasingpower.beanstalk.exception.ResourceNotFoundException;
import com.purchasingpower.beanstalk.registry.RegistryDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.function.Supplier;

/**
 * REST controller exposing the Elastic Beanstalk registry of one region.
 *
 * <p>Parses requests into registry calls and maps registry errors to error bodies:
 * <ul>
 *   <li>{@link DuplicateResourceException} - 400 InvalidParameterValue</li>
 *   <li>{@link ResourceNotFoundException} - 404 ResourceNotFoundException</li>
 *   <li>{@link IllegalArgumentException} - 400 InvalidParameterValue</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/regions")
@RequiredArgsConstructor
public class BeanstalkController {

    private final RegistryDirectory registryDirectory;
    private final BeanstalkProperties properties;

    /**
     * List regions with a registry.
     *
     * GET /api/v1/regions
     */
    @GetMapping
    public ResponseEntity<RegionsResponse> listRegions() {
        return ResponseEntity.ok(new RegionsResponse(properties.getDefaultRegion(), registryDirectory.regions()));
    }

    /**
     * Create an application.
     *
     * POST /api/v1/regions/{region}/applications
     */
    @PostMapping("/{region}/applications")
    public ResponseEntity<?> createApplication(@PathVariable String region,
                                               @RequestBody CreateApplicationRequest request) {
        return execute("CreateApplication", () -> {
            if (request.getApplicationName() == null || request.getApplicationName().isBlank()) {
                return badRequest("Application name is required");
            }

            Application application = registryDirectory.get(region).createApplication(request.getApplicationName());
            return ResponseEntity.ok(ApplicationDescription.from(application));
        });
    }

    /**
     * Describe all applications.
     *
     * GET /api/v1/regions/{region}/applications
     */
    @GetMapping("/{region}/applications")
    public ResponseEntity<?> describeApplications(@PathVariable String region) {
        return execute("DescribeApplications", () -> {
            List<ApplicationDescription> applications = registryDirectory.get(region).describeApplications().stream()
                .map(ApplicationDescription::from)
                .toList();
            return ResponseEntity.ok(applications);
        });
    }

    /**
     * Create an environment under an application.
     *
     * POST /api/v1/regions/{region}/applications/{applicationName}/environments
     */
    @PostMapping("/{region}/applications/{applicationName}/environments")
    public ResponseEntity<?> createEnvironment(@PathVariable String region,
                                               @PathVariable String applicationName,
                                               @RequestBody CreateEnvironmentRequest request) {
        return execute("CreateEnvironment", () -> {
            if (request.getEnvironmentName() == null || request.getEnvironmentName().isBlank()) {
                return badRequest("Environment name is required");
            }

            Environment environment = registryDirectory.get(region).createEnvironment(
                applicationName,
                request.getEnvironmentName(),
                request.getSolutionStackName(),
                request.getTags()
            );
            return ResponseEntity.ok(EnvironmentDescription.from(environment));
        });
    }

    /**
     * Describe all environments.
     *
     * GET /api/v1/regions/{region}/environments
     */
    @GetMapping("/{region}/environments")
    public ResponseEntity<?> describeEnvironments(@PathVariable String region) {
        return execute("DescribeEnvironments", () -> {
            List<EnvironmentDescription> environments = registryDirectory.get(region).describeEnvironments().stream()
                .map(EnvironmentDescription::from)
                .toList();
            return ResponseEntity.ok(environments);
        });
    }

    /**
     * List the tags of a resource.
     *
     * GET /api/v1/regions/{region}/tags?resourceArn=...
     */
    @GetMapping("/{region}/tags")
    public ResponseEntity<?> listTags(@PathVariable String region, @RequestParam String resourceArn) {
        return execute("ListTagsForResource", () -> {
            ResourceTags tags = registryDirectory.get(region).listTags(resourceArn);
            return ResponseEntity.ok(tags);
        });
    }

    /**
     * Add, overwrite and remove tags of a resource.
     *
     * POST /api/v1/regions/{region}/tags
     */
    @PostMapping("/{region}/tags")
    public ResponseEntity<?> updateTags(@PathVariable String region, @RequestBody UpdateTagsRequest request) {
        return execute("UpdateTagsForResource", () -> {
            if (request.getResourceArn() == null || request.getResourceArn().isBlank()) {
                return badRequest("Resource ARN is required");
            }

            ApplicationRegistry registry = registryDirectory.get(region);
            registry.updateTags(request.getResourceArn(), request.getTagsToAdd(), request.getTagsToRemove());
            return ResponseEntity.ok(registry.listTags(request.getResourceArn()));
        });
    }

    /**
     * List the solution stacks environments can be created with.
     *
     * GET /api/v1/regions/{region}/solution-stacks
     */
    @GetMapping("/{region}/solution-stacks")
    public ResponseEntity<?> listAvailableSolutionStacks(@PathVariable String region) {
        return execute("ListAvailableSolutionStacks",
            () -> ResponseEntity.ok(registryDirectory.get(region).listAvailableSolutionStacks()));
    }

    /**
     * Drop every application and environment of a region.
     *
     * POST /api/v1/regions/{region}/reset
     */
    @PostMapping("/{region}/reset")
    public ResponseEntity<?> reset(@PathVariable String region) {
        return execute("Reset", () -> {
            registryDirectory.reset(region);
            return ResponseEntity.noContent().build();
        });
    }

    private ResponseEntity<?> execute(String action, Supplier<ResponseEntity<?>> call) {
        try {
            return call.get();
        } catch (DuplicateResourceException e) {
            log.warn("{} rejected, duplicate resource {}", action, e.getResourceName());
            return badRequest(e.getMessage());
        } catch (ResourceNotFoundException e) {
            log.warn("{} rejected, unknown resource {}", action, e.getResourceId());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(ErrorResponse.RESOURCE_NOT_FOUND, e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.warn("{} rejected: {}", action, e.getMessage());
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("{} failed", action, e);
            return ResponseEntity.internalServerError()
                .body(ErrorResponse.of(ErrorResponse.INTERNAL_FAILURE, action + " failed: " + e.getMessage()));
        }
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(ErrorResponse.INVALID_PARAMETER_VALUE, message));
    }
}
