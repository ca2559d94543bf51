package com.purchasingpower.beanstalk.core;

import com.purchasingpower.beanstalk.exception.DuplicateResourceException;
import com.purchasingpower.beanstalk.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationRegistry")
class ApplicationRegistryTest {

    private static final String ACCOUNT = "123456789012";
    private static final String REGION = "us-east-1";

    private ApplicationRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ApplicationRegistry(ACCOUNT, REGION, List.of("64bit Amazon Linux"));
    }

    @Nested
    @DisplayName("Applications")
    class Applications {

        @Test
        @DisplayName("Should reject a duplicate application name")
        void createApplication_duplicate() {
            registry.createApplication("app1");

            assertThatThrownBy(() -> registry.createApplication("app1"))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessageContaining("app1");
        }

        @Test
        @DisplayName("Should describe applications in registration order")
        void describeApplications_order() {
            registry.createApplication("b");
            registry.createApplication("a");
            registry.createApplication("c");

            assertThat(registry.describeApplications())
                .extracting(Application::getName)
                .containsExactly("b", "a", "c");
        }

        @Test
        @DisplayName("Should fail to get an unknown application")
        void getApplication_unknown() {
            assertThatThrownBy(() -> registry.getApplication("nope"))
                .isInstanceOf(ResourceNotFoundException.class)
                .extracting("resourceId")
                .isEqualTo("nope");
        }
    }

    @Nested
    @DisplayName("Environments")
    class Environments {

        @Test
        @DisplayName("Should fail to create an environment under an unknown application")
        void createEnvironment_unknownApplication() {
            assertThatThrownBy(() -> registry.createEnvironment("missing", "env1", "stack", List.of()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("Should propagate a duplicate environment name and allow it under another application")
        void createEnvironment_duplicateScopedToApplication() {
            registry.createApplication("app1");
            registry.createApplication("app2");
            registry.createEnvironment("app1", "env1", "stack", List.of());

            assertThatThrownBy(() -> registry.createEnvironment("app1", "env1", "stack", List.of()))
                .isInstanceOf(DuplicateResourceException.class);

            Environment other = registry.createEnvironment("app2", "env1", "stack", List.of());
            assertThat(other.getApplicationName()).isEqualTo("app2");
        }

        @Test
        @DisplayName("Should flatten environments by application order then environment order")
        void describeEnvironments_order() {
            registry.createApplication("app1");
            registry.createApplication("app2");
            registry.createEnvironment("app2", "x", "stack", null);
            registry.createEnvironment("app1", "y", "stack", null);
            registry.createEnvironment("app1", "z", "stack", null);

            assertThat(registry.describeEnvironments())
                .extracting(Environment::toString)
                .containsExactly("Environment{app1/y}", "Environment{app1/z}", "Environment{app2/x}");
        }

        @Test
        @DisplayName("Should find an environment by its ARN")
        void findEnvironmentByArn() {
            registry.createApplication("app1");
            registry.createEnvironment("app1", "env1", "stack", null);
            Environment env2 = registry.createEnvironment("app1", "env2", "stack", null);

            assertThat(registry.findEnvironmentByArn(env2.getArn())).isSameAs(env2);
        }

        @Test
        @DisplayName("Should fail to find an unknown ARN")
        void findEnvironmentByArn_unknown() {
            registry.createApplication("app1");
            registry.createEnvironment("app1", "env1", "stack", null);
            String arn = "arn:aws:elasticbeanstalk:us-east-1:123456789012:environment/app1/nope";

            assertThatThrownBy(() -> registry.findEnvironmentByArn(arn))
                .isInstanceOf(ResourceNotFoundException.class)
                .extracting("resourceId")
                .isEqualTo(arn);
        }

        @Test
        @DisplayName("Should not resolve an application ARN as an environment")
        void findEnvironmentByArn_applicationArn() {
            Application application = registry.createApplication("app1");
            registry.createEnvironment("app1", "env1", "stack", null);

            assertThatThrownBy(() -> registry.findEnvironmentByArn(application.getArn()))
                .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Tags")
    class Tags {

        private String arn;

        @BeforeEach
        void createEnvironment() {
            registry.createApplication("app1");
            arn = registry.createEnvironment("app1", "env1", "stack", List.of(new Tag("a", "1"))).getArn();
        }

        @Test
        @DisplayName("Should overwrite an existing key without duplicating it")
        void updateTags_overwrite() {
            registry.updateTags(arn, List.of(new Tag("a", "2")), List.of());

            assertThat(registry.listTags(arn).tags()).containsExactly(new Tag("a", "2"));
        }

        @Test
        @DisplayName("Should append new keys and keep the position of overwritten ones")
        void updateTags_appendAndOverwrite() {
            registry.updateTags(arn, List.of(new Tag("b", "2")), null);
            registry.updateTags(arn, List.of(new Tag("c", "3"), new Tag("a", "9")), null);

            assertThat(registry.listTags(arn).tags())
                .containsExactly(new Tag("a", "9"), new Tag("b", "2"), new Tag("c", "3"));
        }

        @Test
        @DisplayName("Should remove present keys and ignore absent ones")
        void updateTags_remove() {
            registry.updateTags(arn, List.of(new Tag("b", "2")), List.of());

            assertThatCode(() -> registry.updateTags(arn, List.of(), List.of("a", "missing")))
                .doesNotThrowAnyException();

            assertThat(registry.listTags(arn).tags()).containsExactly(new Tag("b", "2"));
        }

        @Test
        @DisplayName("Should apply additions before removals")
        void updateTags_addThenRemove() {
            registry.updateTags(arn, List.of(new Tag("b", "2")), List.of("b"));

            assertThat(registry.listTags(arn).tags()).containsExactly(new Tag("a", "1"));
        }

        @Test
        @DisplayName("Should reject a null tag and leave the tags untouched")
        void updateTags_nullTag() {
            List<Tag> additions = Arrays.asList(new Tag("b", "2"), null);

            assertThatThrownBy(() -> registry.updateTags(arn, additions, List.of("a")))
                .isInstanceOf(IllegalArgumentException.class);

            assertThat(registry.listTags(arn).tags()).containsExactly(new Tag("a", "1"));
        }

        @Test
        @DisplayName("Should reject a tag without a key and leave the tags untouched")
        void updateTags_nullKey() {
            List<Tag> additions = List.of(new Tag("b", "2"), new Tag(null, "3"));

            assertThatThrownBy(() -> registry.updateTags(arn, additions, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("key");

            assertThat(registry.listTags(arn).tags()).containsExactly(new Tag("a", "1"));
        }

        @Test
        @DisplayName("Should reject initial tags without a key and create nothing")
        void createEnvironment_nullKey() {
            List<Tag> tags = List.of(new Tag(null, "x"));

            assertThatThrownBy(() -> registry.createEnvironment("app1", "env2", "stack", tags))
                .isInstanceOf(IllegalArgumentException.class);

            assertThat(registry.describeEnvironments()).hasSize(1);
        }

        @Test
        @DisplayName("Should fail tag operations on an unknown ARN")
        void unknownArn() {
            String unknown = arn + "-gone";

            assertThatThrownBy(() -> registry.updateTags(unknown, List.of(new Tag("x", "y")), List.of()))
                .isInstanceOf(ResourceNotFoundException.class);
            assertThatThrownBy(() -> registry.listTags(unknown))
                .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Should return the ARN with the current tags")
        void listTags() {
            ResourceTags tags = registry.listTags(arn);

            assertThat(tags.resourceArn()).isEqualTo(arn);
            assertThat(tags.tags()).containsExactly(new Tag("a", "1"));
        }
    }

    @Test
    @DisplayName("Should list the configured solution stacks")
    void listAvailableSolutionStacks() {
        assertThat(registry.listAvailableSolutionStacks()).containsExactly("64bit Amazon Linux");
    }

    @Test
    @DisplayName("Should empty the registry on reset and keep its region")
    void reset() {
        registry.createApplication("app1");
        Environment environment = registry.createEnvironment("app1", "env1", "stack", null);
        List<Application> before = registry.describeApplications();
        String arn = environment.getArn();

        registry.reset();

        assertThat(registry.getRegion()).isEqualTo(REGION);
        assertThat(registry.getAccountId()).isEqualTo(ACCOUNT);
        assertThat(registry.describeApplications()).isEmpty();
        assertThat(registry.describeEnvironments()).isEmpty();
        assertThat(before).hasSize(1);
        assertThatThrownBy(() -> registry.findEnvironmentByArn(arn))
            .isInstanceOf(ResourceNotFoundException.class);

        // names are free again after a reset
        registry.createApplication("app1");
        assertThat(registry.createEnvironment("app1", "env1", "stack", null).getArn()).isEqualTo(arn);
    }

    @Test
    @DisplayName("End-to-end: create application and environment, then list empty tags")
    void endToEnd() {
        registry.createApplication("app1");
        Environment environment = registry.createEnvironment("app1", "env1", "64bit Amazon Linux", List.of());

        ResourceTags tags = registry.listTags(environment.getArn());

        assertThat(tags.resourceArn()).isEqualTo("arn:aws:elasticbeanstalk:us-east-1:123456789012:environment/app1/env1");
        assertThat(tags.tags()).isEmpty();
    }

    @Test
    @DisplayName("Should leave mutation of applications and environments to the registry")
    void mutatorsArePackagePrivate() throws Exception {
        assertThat(Modifier.isPublic(Application.class
            .getDeclaredMethod("createEnvironment", String.class, String.class, Collection.class)
            .getModifiers())).isFalse();
        assertThat(Modifier.isPublic(Environment.class
            .getDeclaredMethod("putTag", Tag.class).getModifiers())).isFalse();
        assertThat(Modifier.isPublic(Environment.class
            .getDeclaredMethod("removeTag", String.class).getModifiers())).isFalse();
        assertThat(Application.class.getConstructors()).isEmpty();
        assertThat(Environment.class.getConstructors()).isEmpty();
    }

    @Test
    @DisplayName("Should serialize environment creation with concurrent describes")
    void concurrentCreateEnvironmentAndDescribe() throws Exception {
        registry.createApplication("app1");
        AtomicBoolean writing = new AtomicBoolean(true);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = executor.submit(() -> {
                try {
                    for (int i = 0; i < 5000; i++) {
                        registry.createEnvironment("app1", "env" + i, "stack", null);
                    }
                } finally {
                    writing.set(false);
                }
            });
            Future<Integer> reader = executor.submit(() -> {
                int reads = 0;
                while (writing.get()) {
                    registry.describeEnvironments();
                    reads++;
                }
                return reads;
            });

            writer.get(30, TimeUnit.SECONDS);
            assertThat(reader.get(30, TimeUnit.SECONDS)).isGreaterThanOrEqualTo(0);
            assertThat(registry.describeEnvironments()).hasSize(5000);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should keep names unique under concurrent creation")
    void concurrentCreateApplication() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                String name = "app" + (i % 8);
                results.add(executor.submit(() -> {
                    try {
                        registry.createApplication(name);
                        return true;
                    } catch (DuplicateResourceException e) {
                        return false;
                    }
                }));
            }

            int created = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    created++;
                }
            }

            assertThat(created).isEqualTo(8);
            assertThat(registry.describeApplications()).hasSize(8);
        } finally {
            executor.shutdownNow();
        }
    }
}
