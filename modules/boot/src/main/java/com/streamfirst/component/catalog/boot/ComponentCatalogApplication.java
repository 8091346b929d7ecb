package com.streamfirst.component.catalog.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;

/**
 * Hosts the latest-component resolver. The catalog data source is only created when
 * {@code catalog.store=jdbc}, so the JDBC auto-configuration stays off.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
public class ComponentCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComponentCatalogApplication.class, args);
    }
}
