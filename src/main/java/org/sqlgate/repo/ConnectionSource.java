package org.sqlgate.repo;

import java.sql.Connection;
import java.sql.SQLException;

// One connection per execution; a timed-out or failed one goes back through discard and is never reused
public interface ConnectionSource {

    Connection acquire() throws SQLException;

    // Closes the connection and keeps it out of any pool
    void discard(Connection connection);
}
