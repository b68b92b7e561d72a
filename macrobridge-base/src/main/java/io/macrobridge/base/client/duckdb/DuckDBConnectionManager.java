/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.macrobridge.base.client.duckdb;

import com.google.common.base.Splitter;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.macrobridge.base.MacroBridgeException;
import jakarta.annotation.PreDestroy;
import org.duckdb.DuckDBConnection;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkArgument;
import static io.macrobridge.base.metadata.StandardErrorCode.DATABASE_CONNECTION_ERROR;
import static java.util.Objects.requireNonNull;

/**
 * Owns the single physical DuckDB connection of the process and hands out one cursor per
 * calling thread. A cursor is a connection obtained from {@link DuckDBConnection#duplicate()},
 * so every cursor shares the database instance of the physical handle.
 */
public final class DuckDBConnectionManager
        implements Closeable
{
    private static final Logger LOG = Logger.get(DuckDBConnectionManager.class);
    private static final String DUCKDB_DRIVER = "org.duckdb.DuckDBDriver";
    private static final String DUCKDB_READ_ONLY_PROPERTY = "duckdb.read_only";
    private static final String IN_MEMORY_PATH = ":memory:";

    private final String databasePath;
    private final boolean readOnly;
    private final Optional<String> initSQLPath;

    private final Object lock = new Object();
    private final ThreadLocal<Connection> cursors = new ThreadLocal<>();
    private final Set<Connection> openCursors = ConcurrentHashMap.newKeySet();
    // guarded by lock
    private DuckDBConnection handle;
    // guarded by lock
    private int activeCursors;

    @Inject
    public DuckDBConnectionManager(DuckDBConfig config)
    {
        requireNonNull(config, "config is null");
        this.databasePath = validateDatabasePath(config.getDatabasePath());
        this.readOnly = config.isReadOnly();
        this.initSQLPath = config.getInitSQLPath();
        synchronized (lock) {
            initHandle();
        }
    }

    /**
     * Rejects paths that could escape the working directory. Checked once, when the manager is built.
     */
    public static String validateDatabasePath(String databasePath)
    {
        requireNonNull(databasePath, "databasePath is null");
        checkArgument(!databasePath.startsWith("/") && !databasePath.startsWith("\\"), "Invalid database path: %s", databasePath);
        for (String segment : Splitter.onPattern("[/\\\\]").split(databasePath)) {
            checkArgument(!segment.equals(".."), "Invalid database path: %s", databasePath);
        }
        return databasePath;
    }

    /**
     * Returns the cursor of the calling thread, creating it on first use.
     */
    public Connection acquire()
    {
        Connection cursor = cursors.get();
        if (cursor != null && !isClosed(cursor)) {
            return cursor;
        }
        // cursor closed together with a previous handle
        cursors.remove();

        synchronized (lock) {
            if (handle == null) {
                LOG.info("DuckDB handle is absent, initializing it again");
                initHandle();
            }
            try {
                cursor = handle.duplicate();
            }
            catch (SQLException e) {
                throw new MacroBridgeException(DATABASE_CONNECTION_ERROR, "Failed to create DuckDB cursor: " + e.getMessage(), e);
            }
            activeCursors++;
        }
        openCursors.add(cursor);
        cursors.set(cursor);
        LOG.debug("Created DuckDB cursor for thread %s", Thread.currentThread().getName());
        return cursor;
    }

    public boolean testConnection()
    {
        try (Statement statement = acquire().createStatement();
                ResultSet resultSet = statement.executeQuery("SELECT 1")) {
            return resultSet.next();
        }
        catch (Exception e) {
            LOG.error(e, "Connection test failed");
            return false;
        }
    }

    public int getActiveCursorCount()
    {
        synchronized (lock) {
            return activeCursors;
        }
    }

    public String getDatabasePath()
    {
        return databasePath;
    }

    public boolean isReadOnly()
    {
        return readOnly;
    }

    @PreDestroy
    @Override
    public void close()
    {
        Connection cursor = cursors.get();
        if (cursor != null) {
            cursors.remove();
            closeCursor(cursor);
        }
        for (Connection remaining : openCursors) {
            closeCursor(remaining);
        }
        synchronized (lock) {
            if (handle != null) {
                try {
                    handle.close();
                }
                catch (SQLException e) {
                    LOG.error(e, "Error closing DuckDB handle");
                }
                handle = null;
            }
            activeCursors = 0;
        }
        LOG.info("Closed all DuckDB connections");
    }

    private void closeCursor(Connection cursor)
    {
        if (!openCursors.remove(cursor)) {
            return;
        }
        try {
            cursor.close();
        }
        catch (SQLException e) {
            LOG.error(e, "Error closing DuckDB cursor");
        }
        synchronized (lock) {
            activeCursors = Math.max(0, activeCursors - 1);
        }
    }

    // must hold lock
    private void initHandle()
    {
        DuckDBConnection connection;
        try {
            Class.forName(DUCKDB_DRIVER);
            Properties properties = new Properties();
            if (readOnly && isInMemory(databasePath)) {
                // DuckDB refuses to open an in-memory database in read-only mode
                LOG.info("Ignoring read only setting for in-memory database");
            }
            else if (readOnly) {
                properties.setProperty(DUCKDB_READ_ONLY_PROPERTY, "true");
            }
            connection = (DuckDBConnection) DriverManager.getConnection(jdbcUrl(databasePath), properties);
        }
        catch (SQLException | ClassNotFoundException e) {
            LOG.error(e, "Failed to initialize DuckDB connection to %s", databasePath);
            throw new MacroBridgeException(DATABASE_CONNECTION_ERROR, "Failed to initialize DuckDB connection: " + e.getMessage(), e);
        }

        if (initSQLPath.isPresent()) {
            try (Statement statement = connection.createStatement()) {
                LOG.info("Initialize by init SQL"); // Not print the SQL to avoid leaking sensitive information
                statement.execute(Files.readString(Path.of(initSQLPath.get())));
            }
            catch (SQLException | IOException e) {
                try {
                    connection.close();
                }
                catch (SQLException closeException) {
                    e.addSuppressed(closeException);
                }
                LOG.error(e, "Failed to run init SQL from %s", initSQLPath.get());
                throw new MacroBridgeException(DATABASE_CONNECTION_ERROR, "Failed to run init SQL: " + e.getMessage(), e);
            }
        }
        handle = connection;
        LOG.info("Initialized DuckDB connection to %s (read only: %s)", databasePath, readOnly);
    }

    private static boolean isInMemory(String databasePath)
    {
        return databasePath.isEmpty() || databasePath.equals(IN_MEMORY_PATH);
    }

    private static String jdbcUrl(String databasePath)
    {
        if (isInMemory(databasePath)) {
            return "jdbc:duckdb:";
        }
        return "jdbc:duckdb:" + databasePath;
    }

    private static boolean isClosed(Connection connection)
    {
        try {
            return connection.isClosed();
        }
        catch (SQLException e) {
            return true;
        }
    }
}
