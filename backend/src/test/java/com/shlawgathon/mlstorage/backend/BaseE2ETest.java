package com.shlawgathon.mlstorage.backend;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base class for E2E tests with TestContainers MongoDB.
 * Skipped when no Docker daemon is available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseE2ETest {

    @Container
    static MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:7.0");

    @DynamicPropertySource
    static void setProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongoDBContainer::getReplicaSetUrl);
        registry.add("spring.data.mongodb.database", () -> "mlstorage-test");
        registry.add("mlstorage.collection", () -> "experiments");
        registry.add("mlstorage.purge.enabled", () -> "true");
        // Sweeps are triggered by hand in tests
        registry.add("mlstorage.purge.initial-delay-ms", () -> "3600000");
    }
}
