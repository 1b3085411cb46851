package me.christianrobert.policyguard.executor;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out new JDBC connections. Callers close them.
 */
@FunctionalInterface
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;
}
