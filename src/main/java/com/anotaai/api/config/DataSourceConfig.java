package com.anotaai.api.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataSourceConfig {

    /**
     * One shared Hikari pool for every request. The pool is probed before JPA starts,
     * so an unreachable database stops the boot after the configured retries.
     */
    @Bean
    public HikariDataSource dataSource(DataSourceProperties properties, AppProperties app) {
        AppProperties.Database db = app.getDatabase();

        HikariDataSource ds = properties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
        ds.setPoolName("anotaai-db");
        ds.setMaximumPoolSize(db.getMaxPoolSize());
        ds.setConnectionTimeout(db.getConnectionTimeout().toMillis());

        new DatabaseConnectionRetry(db.getMaxRetries(), db.getRetryDelay()).awaitConnection(ds);
        return ds;
    }
}
