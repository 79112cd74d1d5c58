package org.sqlgate.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

// Unpooled connections, one physical connection per execution
public class DriverManagerConnectionSource implements ConnectionSource {
    private static final Logger LOG = LoggerFactory.getLogger(DriverManagerConnectionSource.class);

    private final String url;
    private final String user;
    private final String password;

    public DriverManagerConnectionSource(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    @Override
    public Connection acquire() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void discard(Connection connection) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("Closing discarded connection failed", e);
        }
    }
}
