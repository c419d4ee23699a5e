package com.messenger;

import com.datastax.oss.driver.api.core.CqlSession;
import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shares one Cassandra container across the integration tests in a JVM. The messenger keyspace
 * and tables from schema.cql are created once, before the first Spring context starts.
 */
public class CassandraContainerInitializer
        implements ApplicationContextInitializer<ConfigurableApplicationContext> {

    private static final int CQL_PORT = 9042;

    static final CassandraContainer<?> CASSANDRA =
            new CassandraContainer<>(DockerImageName.parse("cassandra:4.1"))
                    .withStartupTimeout(Duration.ofMinutes(3));

    static {
        CASSANDRA.start();
        createSchema(schemaStatements());
    }

    static List<String> schemaStatements() {
        try (InputStream in = CassandraContainerInitializer.class.getResourceAsStream("/schema.cql")) {
            if (in == null) {
                throw new IllegalStateException("schema.cql is missing from the test classpath");
            }
            String script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return Arrays.stream(script.split(";"))
                    .map(String::strip)
                    .filter(statement -> !statement.isEmpty())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read schema.cql", e);
        }
    }

    private static void createSchema(List<String> statements) {
        try (CqlSession session = CqlSession.builder()
                .addContactPoint(contactPoint())
                .withLocalDatacenter(CASSANDRA.getLocalDatacenter())
                .build()) {
            statements.forEach(session::execute);
            session.checkSchemaAgreement();
        }
    }

    private static InetSocketAddress contactPoint() {
        return new InetSocketAddress(CASSANDRA.getHost(), CASSANDRA.getMappedPort(CQL_PORT));
    }

    @Override
    public void initialize(ConfigurableApplicationContext context) {
        InetSocketAddress address = contactPoint();
        TestPropertyValues.of(
                "spring.cassandra.contact-points=" + address.getHostString() + ":" + address.getPort(),
                "spring.cassandra.local-datacenter=" + CASSANDRA.getLocalDatacenter(),
                "spring.cassandra.keyspace-name=messenger",
                "spring.cassandra.schema-action=none"
        ).applyTo(context.getEnvironment());
    }
}
