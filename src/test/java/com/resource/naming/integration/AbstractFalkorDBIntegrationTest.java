package com.resource.naming.integration;

import com.resource.naming.api.NamingEngine;
import com.resource.naming.graph.FalkorDBConnection;
import org.junit.jupiter.api.Tag;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

/**
 * Base class for FalkorDB integration tests. Each engine gets its own graph so tests
 * sharing the container do not see each other's rows.
 */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
abstract class AbstractFalkorDBIntegrationTest {

    private static final int FALKORDB_PORT = 6379;

    @SuppressWarnings("resource")
    @Container
    static final GenericContainer<?> falkorDB = new GenericContainer<>("falkordb/falkordb:latest")
            .withExposedPorts(FALKORDB_PORT);

    protected FalkorDBConnection createConnection(String graphNamePrefix) {
        String graphName = graphNamePrefix + "-" + UUID.randomUUID().toString().substring(0, 8);
        return new FalkorDBConnection(falkorDB.getHost(), falkorDB.getMappedPort(FALKORDB_PORT), graphName);
    }

    protected NamingEngine createEngine(String graphNamePrefix) {
        return NamingEngine.builder()
                .graphConnection(createConnection(graphNamePrefix))
                .build();
    }
}
