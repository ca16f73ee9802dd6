package com.geico.poc.streamcatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.cassandra.CassandraAutoConfiguration;

/**
 * The Cassandra session is built by {@link com.geico.poc.streamcatalog.config.CassandraConfig}
 * only when the Cassandra store is selected.
 */
@SpringBootApplication(exclude = CassandraAutoConfiguration.class)
public class StreamCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamCatalogApplication.class, args);
    }
}
