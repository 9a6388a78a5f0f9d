package com.blogicum.integration.base;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Base class for all integration tests.
 * Starts a PostgreSQL container; Flyway creates the schema when the context starts.
 *
 * Uses a lazy-initialized singleton container shared across all tests, only started
 * when Docker is available.
 */
public abstract class FullStackTestBase {

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    private static volatile boolean containerStarted = false;
    private static volatile boolean containerFailed = false;

    /**
     * Clean all data before each test.
     * Order matters due to foreign key constraints: comments -> posts -> categories -> users
     */
    @BeforeEach
    void cleanAllData() {
        if (jdbcTemplate != null) {
            try {
                jdbcTemplate.update("DELETE FROM comments");
                jdbcTemplate.update("DELETE FROM posts");
                jdbcTemplate.update("DELETE FROM categories");
                jdbcTemplate.update("DELETE FROM users");
            } catch (Exception e) {
                // Ignore cleanup errors - tables may not exist yet
            }
        }
    }

    public static boolean isDockerAvailable() {
        if (containerFailed) {
            return false;
        }
        try {
            return DockerClientFactory.instance().isDockerAvailable();
        } catch (Exception e) {
            return false;
        }
    }

    // Lifecycle managed via shutdown hook, not try-with-resources
    @SuppressWarnings("resource")
    private static class ContainerHolder {
        static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
                .withReuse(true);
    }

    private static synchronized void startContainerIfNeeded() {
        if (containerStarted || containerFailed) {
            return;
        }
        try {
            ContainerHolder.postgres.start();
            containerStarted = true;
            Runtime.getRuntime().addShutdownHook(new Thread(ContainerHolder.postgres::close));
        } catch (Exception e) {
            containerFailed = true;
            throw e;
        }
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        if (!isDockerAvailable()) {
            // Provide dummy values so context can load (tests will be skipped)
            registerDummyDataSource(registry);
            return;
        }

        try {
            startContainerIfNeeded();
        } catch (Exception e) {
            registerDummyDataSource(registry);
            return;
        }

        registry.add("spring.datasource.url", ContainerHolder.postgres::getJdbcUrl);
        registry.add("spring.datasource.username", ContainerHolder.postgres::getUsername);
        registry.add("spring.datasource.password", ContainerHolder.postgres::getPassword);
    }

    private static void registerDummyDataSource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", () -> "jdbc:postgresql://localhost:5432/dummy");
        registry.add("spring.datasource.username", () -> "dummy");
        registry.add("spring.datasource.password", () -> "dummy");
    }
}
