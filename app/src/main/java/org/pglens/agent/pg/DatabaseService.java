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
package org.pglens.agent.pg;

import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.AgroalConnectionFactoryConfiguration;
import io.smallrye.faulttolerance.api.CircuitBreakerName;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.pglens.agent.model.PostgresVersion;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Service for database operations with fault tolerance
 */
@Slf4j
@ApplicationScoped
public class DatabaseService {
    static final String SHOW_SERVER_VERSION = "SHOW server_version";
    static final String URL_UNAVAILABLE = "unavailable";

    private final AgroalDataSource dataSource;
    private final AtomicReference<PostgresVersion> cachedVersionRef = new AtomicReference<>();

    @Inject
    public DatabaseService(AgroalDataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * JDBC URL of the pooled data source, for logging.
     *
     * @return JDBC URL or "unavailable" if the pool has no connection factory configuration
     */
    public String getUrl() {
        try {
            AgroalConnectionFactoryConfiguration factory = dataSource.getConfiguration()
                    .connectionPoolConfiguration().connectionFactoryConfiguration();
            return factory != null && factory.jdbcUrl() != null ? factory.jdbcUrl() : URL_UNAVAILABLE;
        } catch (IllegalStateException e) {
            log.debug("Could not retrieve JDBC URL", e);
            return URL_UNAVAILABLE;
        }
    }

    /**
     * Get database connection from the pool
     */
    public Connection getPooledConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Detect and cache the server version
     */
    @Retry(delay = 1, delayUnit = ChronoUnit.SECONDS)
    @Timeout(value = 5, unit = ChronoUnit.SECONDS)
    @CircuitBreaker(requestVolumeThreshold = 10, delay = 30, delayUnit = ChronoUnit.SECONDS)
    @CircuitBreakerName("version-detection")
    public PostgresVersion detectVersion() throws SQLException {
        PostgresVersion cached = cachedVersionRef.get();
        if (cached != null) {
            return cached;
        }
        try (Connection conn = getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(SHOW_SERVER_VERSION)) {
            PostgresVersion parsed = parseVersion(rs);
            cachedVersionRef.compareAndSet(null, parsed);
            return cachedVersionRef.get();
        } catch (SQLException e) {
            log.warn("Failed to detect PostgreSQL version (attempt may be retried)", e);
            throw e;
        }
    }

    /**
     * Test database connectivity
     */
    @Timeout(value = 5, unit = ChronoUnit.SECONDS)
    public boolean testConnection() {
        try (Connection conn = getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT 1")) {
            return rs.next() && rs.getInt(1) == 1;
        } catch (SQLException e) {
            log.debug("Connection test failed", e);
            return false;
        } catch (Exception e) {
            log.warn("Unexpected error during connection test", e);
            return false;
        }
    }

    private PostgresVersion parseVersion(ResultSet rs) throws SQLException {
        if (!rs.next()) {
            throw new SQLException("Unable to detect PostgreSQL version: no rows");
        }
        String versionString = rs.getString(1);
        PostgresVersion parsed = PostgresVersion.parse(versionString);
        if (parsed == null) {
            throw new SQLException("Unable to detect PostgreSQL version from: " + versionString);
        }
        log.info("Detected PostgreSQL version: {}", versionString);
        return parsed;
    }
}
