/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pglens.agent.connection;

import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalPropertiesReader;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.pglens.agent.collector.explain.DedicatedConnection;
import org.pglens.agent.collector.explain.ExplainConnectionFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opens connections to individual databases of the monitored server.
 *
 * <p>Each connection comes from its own single-connection DataSource, created for one
 * EXPLAIN attempt and closed together with the connection. The JDBC URL is derived from
 * {@code quarkus.datasource.jdbc.url} by replacing its database path segment.
 */
@Slf4j
@ApplicationScoped
public class DbDatasourceFactory implements ExplainConnectionFactory {

    private static final int CONNECTION_POOL_SIZE = 1;
    private static final int CONNECTION_MAX_LIFETIME_SECONDS = 120;

    // prefix up to the last '/', database segment, optional query string
    private static final Pattern DATABASE_SEGMENT = Pattern.compile("^(.+://[^?]*/)([^/?]+)(\\?.*)?$");

    @ConfigProperty(name = "quarkus.datasource.jdbc.url")
    String jdbcUrl;

    @ConfigProperty(name = "quarkus.datasource.username")
    String username;

    @ConfigProperty(name = "quarkus.datasource.password")
    String password;

    @Override
    public DedicatedConnection open(String databaseName) throws SQLException {
        AgroalDataSource dataSource = create(databaseName);
        try {
            Connection connection = dataSource.getConnection();
            return new DedicatedConnection(connection, dataSource::close);
        } catch (SQLException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Create a new DataSource for the specified database.
     *
     * @param databaseName Name of the target database
     * @return Configured AgroalDataSource for the database
     * @throws SQLException             If DataSource creation fails
     * @throws IllegalArgumentException If database name is invalid or the URL has no database segment
     */
    public AgroalDataSource create(String databaseName) throws SQLException {
        validateDatabaseName(databaseName);

        Map<String, String> props = new HashMap<>();
        props.put(AgroalPropertiesReader.JDBC_URL, createJdbcUrlForDatabase(databaseName));
        props.put(AgroalPropertiesReader.PRINCIPAL, username);
        props.put(AgroalPropertiesReader.CREDENTIAL, password);
        props.put(AgroalPropertiesReader.MAX_SIZE, String.valueOf(CONNECTION_POOL_SIZE));
        props.put(AgroalPropertiesReader.MIN_SIZE, "0");
        props.put(AgroalPropertiesReader.INITIAL_SIZE, "0");
        props.put(AgroalPropertiesReader.MAX_LIFETIME_S, String.valueOf(CONNECTION_MAX_LIFETIME_SECONDS));

        try {
            AgroalDataSource dataSource = AgroalDataSource.from(
                    new AgroalPropertiesReader().readProperties(props).get()
            );
            log.debug("Created DataSource for database '{}'", databaseName);
            return dataSource;
        } catch (SQLException e) {
            log.error("Failed to create DataSource for database '{}': {}", databaseName, e.getMessage());
            throw e;
        }
    }

    /**
     * Create a JDBC URL for the specified database, keeping any query string.
     *
     * @param databaseName Name of the target database
     * @return JDBC URL pointing to the specified database
     * @throws IllegalArgumentException If the configured URL has no database path segment
     */
    public String createJdbcUrlForDatabase(String databaseName) {
        if (jdbcUrl == null) {
            throw new IllegalArgumentException("quarkus.datasource.jdbc.url is not configured");
        }
        Matcher matcher = DATABASE_SEGMENT.matcher(jdbcUrl);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("no database name found in connection url");
        }
        String query = matcher.group(3) != null ? matcher.group(3) : "";
        String modifiedUrl = matcher.group(1) + databaseName + query;
        log.trace("Created JDBC URL for database '{}': {}", databaseName, modifiedUrl);
        return modifiedUrl;
    }

    /**
     * Validate the database name to prevent SQL injection or invalid names.
     *
     * @param databaseName Database name to validate
     * @throws IllegalArgumentException If database name is invalid
     */
    private void validateDatabaseName(String databaseName) {
        if (databaseName == null || databaseName.trim().isEmpty()) {
            throw new IllegalArgumentException("Database name cannot be null or empty");
        }

        // database names end up in URLs and statements
        if (databaseName.contains(";") || databaseName.contains("'") || databaseName.contains("\"")
                || databaseName.contains("--") || databaseName.contains("/") || databaseName.contains("?")) {
            throw new IllegalArgumentException("Database name contains invalid characters: " + databaseName);
        }
    }
}
