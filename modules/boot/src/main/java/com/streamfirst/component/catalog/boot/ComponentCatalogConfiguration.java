package com.streamfirst.component.catalog.boot;

import com.streamfirst.component.catalog.adapters.InMemoryCandidateAdapter;
import com.streamfirst.component.catalog.adapters.jdbc.JdbcCandidateAdapter;
import com.streamfirst.component.catalog.application.LatestComponentResolver;
import com.streamfirst.component.catalog.ports.CandidatePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.support.JdbcTransactionManager;

import javax.sql.DataSource;

/**
 * Wires the candidate store selected by {@code catalog.store} into the latest-component resolver.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CatalogProperties.class)
public class ComponentCatalogConfiguration {

    // --- Application Service Beans ---

    @Bean
    public LatestComponentResolver latestComponentResolver(CandidatePort candidatePort, CatalogProperties properties) {
        log.info("Creating latest component resolver with tie-break policy {}", properties.getTieBreak());
        return new LatestComponentResolver(candidatePort, properties.getTieBreak());
    }

    // --- Adapter Beans ---

    @Configuration
    @ConditionalOnCatalogStore(CatalogProperties.Store.IN_MEMORY)
    static class InMemoryStoreConfiguration {

        @Bean
        public InMemoryCandidateAdapter inMemoryCandidateAdapter() {
            log.info("Creating in-memory candidate store");
            return new InMemoryCandidateAdapter();
        }
    }

    @Configuration
    @ConditionalOnCatalogStore(CatalogProperties.Store.JDBC)
    static class JdbcStoreConfiguration {

        @Bean
        @ConfigurationProperties("spring.datasource")
        public DataSourceProperties catalogDataSourceProperties() {
            return new DataSourceProperties();
        }

        @Bean
        @ConfigurationProperties("spring.datasource.hikari")
        public DataSource catalogDataSource(DataSourceProperties catalogDataSourceProperties) {
            log.info("Creating catalog data source for {}", catalogDataSourceProperties.getUrl());
            return catalogDataSourceProperties.initializeDataSourceBuilder().build();
        }

        @Bean
        public JdbcTransactionManager catalogTransactionManager(DataSource catalogDataSource) {
            return new JdbcTransactionManager(catalogDataSource);
        }

        @Bean
        public JdbcCandidateAdapter jdbcCandidateAdapter(DataSource catalogDataSource,
                                                         JdbcTransactionManager catalogTransactionManager,
                                                         CatalogProperties properties) {
            CatalogProperties.Jdbc jdbc = properties.getJdbc();
            return new JdbcCandidateAdapter(catalogDataSource, catalogTransactionManager,
                    jdbc.getQueryTimeout(), jdbc.getIsolation().value());
        }
    }
}
