package com.geico.poc.streamcatalog.config;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.config.DefaultDriverOption;
import com.datastax.oss.driver.api.core.config.DriverConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Cassandra configuration
 * Only active when the catalog is persisted in Cassandra.
 */
@Configuration
@ConditionalOnProperty(name = "stream-catalog.store.type", havingValue = "cassandra")
public class CassandraConfig {

    private static final Logger log = LoggerFactory.getLogger(CassandraConfig.class);

    @Value("${cassandra.contact-points:localhost}")
    private String contactPoints;

    @Value("${cassandra.port:9042}")
    private int port;

    @Value("${cassandra.local-datacenter:datacenter1}")
    private String localDatacenter;

    @Value("${cassandra.request-timeout-seconds:10}")
    private int requestTimeoutSeconds;

    @Bean(destroyMethod = "close")
    public CqlSession cassandraSession() {
        log.info("Configuring Cassandra session: contact point {}:{}, datacenter {}",
                contactPoints, port, localDatacenter);

        // Catalog batches must be visible to every reader once acknowledged
        DriverConfigLoader loader = DriverConfigLoader.programmaticBuilder()
            .withString(DefaultDriverOption.REQUEST_CONSISTENCY, "QUORUM")
            .withDuration(DefaultDriverOption.REQUEST_TIMEOUT, Duration.ofSeconds(requestTimeoutSeconds))
            .build();

        try {
            CqlSession session = CqlSession.builder()
                .addContactPoint(new InetSocketAddress(contactPoints, port))
                .withLocalDatacenter(localDatacenter)
                .withConfigLoader(loader)
                .build();
            log.info("Cassandra session created");
            return session;
        } catch (RuntimeException e) {
            log.error("Failed to create Cassandra session against {}:{}: {}", contactPoints, port, e.getMessage());
            throw e;
        }
    }
}
