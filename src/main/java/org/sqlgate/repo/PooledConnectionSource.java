package org.sqlgate.repo;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.dropwizard.lifecycle.Managed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

// HikariCP-backed connection pool whose lifetime follows the application
public class PooledConnectionSource implements ConnectionSource, Managed {
    private static final Logger LOG = LoggerFactory.getLogger(PooledConnectionSource.class);

    private final HikariDataSource dataSource;

    public PooledConnectionSource(String url, String user, String password, int poolSize) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(password);
        cfg.setMaximumPoolSize(poolSize);
        cfg.setReadOnly(true);
        cfg.setAutoCommit(false);
        cfg.setPoolName("sqlgate");
        this.dataSource = new HikariDataSource(cfg);
    }

    public PooledConnectionSource(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Connection acquire() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    public void discard(Connection connection) {
        if (connection == null) return;
        try {
            dataSource.evictConnection(connection);
        } catch (Exception e) {
            LOG.warn("Evicting connection failed", e);
        }
    }

    @Override
    public void start() {
        LOG.info("Connection pool {} ready (max {})", dataSource.getPoolName(), dataSource.getMaximumPoolSize());
    }

    @Override
    public void stop() {
        dataSource.close();
    }
}
