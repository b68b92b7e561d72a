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

import io.macrobridge.base.MacroBridgeException;
import io.macrobridge.base.client.jdbc.JdbcRecordIterator;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.macrobridge.base.client.duckdb.DuckDBConnectionManager.validateDatabasePath;
import static io.macrobridge.base.metadata.StandardErrorCode.DATABASE_CONNECTION_ERROR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestDuckDBConnectionManager
{
    private DuckDBConnectionManager connectionManager;

    @BeforeMethod
    public void setUp()
    {
        connectionManager = new DuckDBConnectionManager(inMemoryConfig());
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown()
    {
        connectionManager.close();
    }

    @Test
    public void testValidateDatabasePath()
    {
        assertThat(validateDatabasePath("data/database.duckdb")).isEqualTo("data/database.duckdb");
        assertThat(validateDatabasePath(":memory:")).isEqualTo(":memory:");
        assertThat(validateDatabasePath("data/..backup/db.duckdb")).isEqualTo("data/..backup/db.duckdb");

        assertThatThrownBy(() -> validateDatabasePath("/etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid database path: /etc/passwd");
        assertThatThrownBy(() -> validateDatabasePath("\\\\server\\share\\db"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validateDatabasePath("../secret.duckdb"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validateDatabasePath("data\\..\\secret.duckdb"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DuckDBConnectionManager(inMemoryConfig().setDatabasePath("data/../../db.duckdb")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testCursorPerThread()
            throws Exception
    {
        Connection first = connectionManager.acquire();
        assertThat(connectionManager.acquire()).isSameAs(first);
        assertThat(connectionManager.getActiveCursorCount()).isEqualTo(1);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Connection other = CompletableFuture.supplyAsync(connectionManager::acquire, executor).get();
            assertThat(other).isNotSameAs(first);
            assertThat(CompletableFuture.supplyAsync(connectionManager::acquire, executor).get()).isSameAs(other);
        }
        finally {
            executor.shutdownNow();
        }
        assertThat(connectionManager.getActiveCursorCount()).isEqualTo(2);
    }

    @Test
    public void testCursorsShareDatabase()
            throws Exception
    {
        connectionManager.acquire().createStatement().execute("CREATE TABLE shared AS SELECT 42 AS answer");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            List<Object> row = CompletableFuture.supplyAsync(() -> {
                try (JdbcRecordIterator iterator = JdbcRecordIterator.of(connectionManager.acquire(), "SELECT answer FROM shared")) {
                    return iterator.next();
                }
                catch (Exception e) {
                    throw new RuntimeException(e);
                }
            }, executor).get();
            assertThat(row).containsExactly(42);
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testTestConnection()
    {
        assertThat(connectionManager.testConnection()).isTrue();
    }

    @Test
    public void testReadOnlyFileDatabase()
            throws Exception
    {
        Path database = Path.of("target", "read-only-test.duckdb");
        Path wal = Path.of("target", "read-only-test.duckdb.wal");
        Files.createDirectories(database.getParent());
        Files.deleteIfExists(database);
        Files.deleteIfExists(wal);
        DuckDBConfig config = new DuckDBConfig().setDatabasePath(database.toString());
        try {
            try (DuckDBConnectionManager writer = new DuckDBConnectionManager(config.setReadOnly(false));
                    Statement statement = writer.acquire().createStatement()) {
                statement.execute("CREATE TABLE numbers AS SELECT 1 AS n");
                statement.execute("INSERT INTO numbers VALUES (2)");
            }

            try (DuckDBConnectionManager reader = new DuckDBConnectionManager(config.setReadOnly(true));
                    Statement statement = reader.acquire().createStatement()) {
                assertThatThrownBy(() -> statement.execute("INSERT INTO numbers VALUES (3)"))
                        .isInstanceOf(SQLException.class)
                        .hasMessageContaining("read-only");
                try (ResultSet resultSet = statement.executeQuery("SELECT count(*) FROM numbers")) {
                    assertThat(resultSet.next()).isTrue();
                    assertThat(resultSet.getLong(1)).isEqualTo(2L);
                }
            }
        }
        finally {
            Files.deleteIfExists(database);
            Files.deleteIfExists(wal);
        }
    }

    @Test
    public void testReadOnlyIgnoredForInMemory()
    {
        DuckDBConfig config = new DuckDBConfig().setDatabasePath(":memory:");
        assertThat(config.isReadOnly()).isTrue();
        try (DuckDBConnectionManager manager = new DuckDBConnectionManager(config)) {
            assertThat(manager.testConnection()).isTrue();
        }
    }

    @Test
    public void testCloseWithoutCursor()
    {
        connectionManager.close();
        assertThat(connectionManager.getActiveCursorCount()).isEqualTo(0);
        // closing twice is harmless
        connectionManager.close();
    }

    @Test
    public void testAcquireAfterClose()
    {
        Connection before = connectionManager.acquire();
        connectionManager.close();
        assertThat(connectionManager.getActiveCursorCount()).isEqualTo(0);

        Connection after = connectionManager.acquire();
        assertThat(after).isNotSameAs(before);
        assertThat(connectionManager.getActiveCursorCount()).isEqualTo(1);
        assertThat(connectionManager.testConnection()).isTrue();
    }

    @Test
    public void testInitSQL()
            throws Exception
    {
        Path initSQL = Files.createTempFile("init", ".sql");
        Files.writeString(initSQL, "CREATE MACRO twice(x) AS x * 2;");
        try (DuckDBConnectionManager manager = new DuckDBConnectionManager(inMemoryConfig().setInitSQLPath(initSQL.toString()));
                JdbcRecordIterator iterator = JdbcRecordIterator.of(manager.acquire(), "SELECT twice(?)", List.of(21))) {
            assertThat(iterator.getColumnNames()).hasSize(1);
            assertThat(((Number) iterator.next().get(0)).longValue()).isEqualTo(42L);
        }
        finally {
            Files.deleteIfExists(initSQL);
        }
    }

    @Test
    public void testMissingInitSQL()
    {
        assertThatThrownBy(() -> new DuckDBConnectionManager(inMemoryConfig().setInitSQLPath("/does/not/exist.sql")))
                .isInstanceOf(MacroBridgeException.class)
                .hasMessageStartingWith("Failed to run init SQL")
                .satisfies(e -> assertThat(((MacroBridgeException) e).getErrorCode()).isEqualTo(DATABASE_CONNECTION_ERROR.toErrorCode()));
    }

    private static DuckDBConfig inMemoryConfig()
    {
        return new DuckDBConfig()
                .setDatabasePath(":memory:")
                .setReadOnly(false);
    }
}
