package com.geotiler.credentialprovider;

/**
 * Creates the database connection pool from a JDBC URL. Called once at startup.
 */
@FunctionalInterface
public interface ConnectionPoolInitializer {
  void initialize(String jdbcUrl);
}
