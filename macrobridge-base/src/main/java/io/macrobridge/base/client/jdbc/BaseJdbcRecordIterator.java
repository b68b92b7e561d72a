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

package io.macrobridge.base.client.jdbc;

import com.google.common.collect.ImmutableList;
import io.macrobridge.base.client.AutoCloseableIterator;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * Iterates the rows of one prepared query run on a borrowed connection.
 * Closing the iterator releases the statement and the result set but leaves the connection open,
 * since the connection is a cursor owned by the calling thread.
 */
public abstract class BaseJdbcRecordIterator<T>
        implements AutoCloseableIterator<T>
{
    protected final PreparedStatement statement;
    protected final ResultSet resultSet;
    private final ResultSetMetaData resultSetMetaData;
    protected final int columnCount;

    private boolean hasNext;

    public BaseJdbcRecordIterator(Connection connection, String sql, List<Object> parameters)
            throws SQLException
    {
        requireNonNull(connection, "connection is null");
        statement = connection.prepareStatement(sql);
        try {
            setParameter(parameters);
            resultSet = statement.executeQuery();

            this.resultSetMetaData = resultSet.getMetaData();
            this.columnCount = resultSetMetaData.getColumnCount();

            hasNext = resultSet.next();
        }
        catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    protected void setParameter(List<Object> parameters)
            throws SQLException
    {
        for (int i = 0; i < parameters.size(); i++) {
            statement.setObject(i + 1, parameters.get(i));
        }
    }

    @Override
    public boolean hasNext()
    {
        return hasNext;
    }

    @Override
    public T next()
    {
        if (!hasNext) {
            throw new NoSuchElementException();
        }
        T currentResult;
        try {
            currentResult = getCurrentRecord();
            // move to next row
            hasNext = resultSet.next();
        }
        catch (SQLException e) {
            throw new RuntimeException(e);
        }
        return currentResult;
    }

    @Override
    public void close()
            throws SQLException
    {
        // use try with resources to close everything properly
        try (PreparedStatement statement = this.statement;
                ResultSet resultSet = this.resultSet) {
            hasNext = false;
        }
    }

    public List<String> getColumnNames()
            throws SQLException
    {
        ImmutableList.Builder<String> names = ImmutableList.builderWithExpectedSize(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            names.add(resultSetMetaData.getColumnLabel(i));
        }
        return names.build();
    }

    public ResultSetMetaData getResultSetMetaData()
    {
        return resultSetMetaData;
    }

    public abstract T getCurrentRecord()
            throws SQLException;
}
