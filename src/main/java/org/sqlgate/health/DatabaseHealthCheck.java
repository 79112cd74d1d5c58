package org.sqlgate.health;

import com.codahale.metrics.health.HealthCheck;
import org.sqlgate.repo.ConnectionSource;

import java.sql.Connection;

// Healthy when a pooled connection can be obtained and is valid
public class DatabaseHealthCheck extends HealthCheck {
    private final ConnectionSource connections;

    public DatabaseHealthCheck(ConnectionSource connections) {
        this.connections = connections;
    }

    @Override
    protected Result check() throws Exception {
        try (Connection c = connections.acquire()) {
            if (c.isValid(5)) return Result.healthy();
            return Result.unhealthy("connection is not valid");
        }
    }
}
