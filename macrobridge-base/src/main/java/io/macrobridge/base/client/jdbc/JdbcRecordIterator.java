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

import java.lang.reflect.Array;
import java.sql.Blob;
import java.sql.Connection;
import java.sql.Date;
import java.sql.SQLException;
import java.sql.Struct;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static java.util.Collections.emptyList;

/**
 * Reads rows as lists of JSON friendly values: temporal values become ISO-8601 text,
 * SQL arrays and structs become lists.
 */
public class JdbcRecordIterator
        extends BaseJdbcRecordIterator<List<Object>>
{
    public static JdbcRecordIterator of(Connection connection, String sql)
            throws SQLException
    {
        return of(connection, sql, emptyList());
    }

    public static JdbcRecordIterator of(Connection connection, String sql, List<Object> parameters)
            throws SQLException
    {
        return new JdbcRecordIterator(connection, sql, parameters);
    }

    private JdbcRecordIterator(Connection connection, String sql, List<Object> parameters)
            throws SQLException
    {
        super(connection, sql, parameters);
    }

    @Override
    public List<Object> getCurrentRecord()
            throws SQLException
    {
        List<Object> builder = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            int columnType = getResultSetMetaData().getColumnType(i);
            if (columnType == Types.BLOB) {
                Blob blob = resultSet.getBlob(i);
                builder.add(blob == null ? null : blob.getBytes(1, (int) blob.length()));
            }
            else if (columnType == Types.SMALLINT) {
                short value = resultSet.getShort(i);
                builder.add(resultSet.wasNull() ? null : value);
            }
            else {
                builder.add(normalize(resultSet.getObject(i)));
            }
        }
        // null cells are legal, so no ImmutableList here
        return Collections.unmodifiableList(builder);
    }

    public static Object normalize(Object value)
            throws SQLException
    {
        if (value == null) {
            return null;
        }
        if (value instanceof Date) {
            return ((Date) value).toLocalDate().toString();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toString();
        }
        if (value instanceof Time) {
            return ((Time) value).toLocalTime().toString();
        }
        if (value instanceof TemporalAccessor || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof java.sql.Array) {
            return normalizeArray(((java.sql.Array) value).getArray());
        }
        if (value instanceof Struct) {
            return normalizeArray(((Struct) value).getAttributes());
        }
        return value;
    }

    private static List<Object> normalizeArray(Object array)
            throws SQLException
    {
        if (array == null) {
            return null;
        }
        List<Object> elements = new ArrayList<>();
        if (array instanceof Object[]) {
            for (Object element : Arrays.asList((Object[]) array)) {
                elements.add(normalize(element));
            }
        }
        else {
            for (int i = 0; i < Array.getLength(array); i++) {
                elements.add(normalize(Array.get(array, i)));
            }
        }
        return Collections.unmodifiableList(elements);
    }
}
