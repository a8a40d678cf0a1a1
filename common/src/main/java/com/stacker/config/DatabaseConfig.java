package com.stacker.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Connection settings for the relational store the documents are projected from.
 */
@Data
@NoArgsConstructor
public class DatabaseConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 4;
    private long connectionTimeoutMs = 30_000;

    /**
     * Opens a pooled data source for these settings. The caller owns (and closes) the pool.
     */
    public HikariDataSource createDataSource() {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(jdbcUrl);
        hikari.setUsername(username);
        hikari.setPassword(password);
        hikari.setMaximumPoolSize(maximumPoolSize);
        hikari.setConnectionTimeout(connectionTimeoutMs);
        hikari.setReadOnly(true);
        hikari.setPoolName("stacker-projector");
        return new HikariDataSource(hikari);
    }
}
