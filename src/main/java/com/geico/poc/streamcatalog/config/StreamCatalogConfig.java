package com.geico.poc.streamcatalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration for the stream catalog service
 */
@Configuration
@ConfigurationProperties(prefix = "stream-catalog")
public class StreamCatalogConfig {

    private StoreConfig store = new StoreConfig();
    private NotificationConfig notification = new NotificationConfig();
    private BootstrapConfig bootstrap = new BootstrapConfig();

    public enum StoreType {
        /**
         * Catalog kept in process memory. Lost on restart.
         */
        MEMORY,

        /**
         * Catalog persisted in a Cassandra table, one logged batch per transaction.
         */
        CASSANDRA
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store;
    }

    public NotificationConfig getNotification() {
        return notification;
    }

    public void setNotification(NotificationConfig notification) {
        this.notification = notification;
    }

    public BootstrapConfig getBootstrap() {
        return bootstrap;
    }

    public void setBootstrap(BootstrapConfig bootstrap) {
        this.bootstrap = bootstrap;
    }

    /**
     * Durable store settings
     */
    public static class StoreConfig {
        private StoreType type = StoreType.MEMORY;
        private String keyspace = "stream_catalog";
        private String table = "catalog_objects";

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getKeyspace() {
            return keyspace;
        }

        public void setKeyspace(String keyspace) {
            this.keyspace = keyspace;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }
    }

    /**
     * Notification fan-out settings
     */
    public static class NotificationConfig {
        private int subscriberQueueCapacity = 1024;
        private long maxPollWaitMs = 30000;

        public int getSubscriberQueueCapacity() {
            return subscriberQueueCapacity;
        }

        public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
            this.subscriberQueueCapacity = subscriberQueueCapacity;
        }

        public long getMaxPollWaitMs() {
            return maxPollWaitMs;
        }

        public void setMaxPollWaitMs(long maxPollWaitMs) {
            this.maxPollWaitMs = maxPollWaitMs;
        }
    }

    /**
     * Objects created on first start, when the store is empty
     */
    public static class BootstrapConfig {
        private boolean enabled = true;
        private String defaultDatabase = "dev";
        private List<String> defaultSchemas = new ArrayList<>(Arrays.asList("public", "pg_catalog", "information_schema"));
        private int defaultOwner = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDefaultDatabase() {
            return defaultDatabase;
        }

        public void setDefaultDatabase(String defaultDatabase) {
            this.defaultDatabase = defaultDatabase;
        }

        public List<String> getDefaultSchemas() {
            return defaultSchemas;
        }

        public void setDefaultSchemas(List<String> defaultSchemas) {
            this.defaultSchemas = defaultSchemas;
        }

        public int getDefaultOwner() {
            return defaultOwner;
        }

        public void setDefaultOwner(int defaultOwner) {
            this.defaultOwner = defaultOwner;
        }
    }
}
