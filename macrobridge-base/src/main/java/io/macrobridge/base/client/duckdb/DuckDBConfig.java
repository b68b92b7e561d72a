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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.Duration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Optional;

import static java.util.concurrent.TimeUnit.SECONDS;

public class DuckDBConfig
{
    public static final String DUCKDB_DATABASE_PATH = "duckdb.database-path";
    public static final String DUCKDB_READ_ONLY = "duckdb.read-only";
    public static final String DUCKDB_INIT_SQL_PATH = "duckdb.init-sql-path";
    public static final String DUCKDB_CONNECTION_TIMEOUT = "duckdb.connection-timeout";
    public static final String DUCKDB_QUERY_TIMEOUT = "duckdb.query-timeout";
    public static final String DUCKDB_MAX_CONCURRENT_TASKS = "duckdb.max-concurrent-tasks";

    private String databasePath = "data/database.duckdb";
    private boolean readOnly = true;
    private String initSQLPath;
    private Duration connectionTimeout = new Duration(30, SECONDS);
    private Duration queryTimeout = new Duration(300, SECONDS);
    private int maxConcurrentTasks = 10;

    @NotNull
    public String getDatabasePath()
    {
        return databasePath;
    }

    @Config(DUCKDB_DATABASE_PATH)
    @ConfigDescription("Relative path of the DuckDB database file, or :memory:")
    public DuckDBConfig setDatabasePath(String databasePath)
    {
        this.databasePath = databasePath;
        return this;
    }

    public boolean isReadOnly()
    {
        return readOnly;
    }

    @Config(DUCKDB_READ_ONLY)
    public DuckDBConfig setReadOnly(boolean readOnly)
    {
        this.readOnly = readOnly;
        return this;
    }

    public Optional<String> getInitSQLPath()
    {
        return Optional.ofNullable(initSQLPath);
    }

    @Config(DUCKDB_INIT_SQL_PATH)
    @ConfigDescription("SQL file executed once on the database handle after it is opened")
    public DuckDBConfig setInitSQLPath(String initSQLPath)
    {
        this.initSQLPath = initSQLPath;
        return this;
    }

    @NotNull
    public Duration getConnectionTimeout()
    {
        return connectionTimeout;
    }

    @Config(DUCKDB_CONNECTION_TIMEOUT)
    public DuckDBConfig setConnectionTimeout(Duration connectionTimeout)
    {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    @NotNull
    public Duration getQueryTimeout()
    {
        return queryTimeout;
    }

    @Config(DUCKDB_QUERY_TIMEOUT)
    public DuckDBConfig setQueryTimeout(Duration queryTimeout)
    {
        this.queryTimeout = queryTimeout;
        return this;
    }

    @Min(1)
    public int getMaxConcurrentTasks()
    {
        return maxConcurrentTasks;
    }

    @Config(DUCKDB_MAX_CONCURRENT_TASKS)
    public DuckDBConfig setMaxConcurrentTasks(int maxConcurrentTasks)
    {
        this.maxConcurrentTasks = maxConcurrentTasks;
        return this;
    }
}
