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

package io.macrobridge.base.macro;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Outcome of one macro execution. {@code data} holds the single cell of a scalar macro or
 * the row list of a table macro; {@code columns} is only present for table macros.
 */
public final class ExecutionResult
{
    private final boolean success;
    private final Object data;
    private final List<String> columns;
    private final long rowCount;
    private final double executionTimeMs;

    public static ExecutionResult scalarResult(Object value, double executionTimeMs)
    {
        return new ExecutionResult(true, value, null, value == null ? 0 : 1, executionTimeMs);
    }

    public static ExecutionResult tableResult(List<String> columns, List<List<Object>> rows, double executionTimeMs)
    {
        return new ExecutionResult(true, rows, columns, rows.size(), executionTimeMs);
    }

    @JsonCreator
    public ExecutionResult(
            @JsonProperty("success") boolean success,
            @JsonProperty("data") Object data,
            @JsonProperty("columns") List<String> columns,
            @JsonProperty("row_count") long rowCount,
            @JsonProperty("execution_time_ms") double executionTimeMs)
    {
        this.success = success;
        this.data = data;
        this.columns = columns == null ? null : ImmutableList.copyOf(columns);
        this.rowCount = rowCount;
        this.executionTimeMs = executionTimeMs;
    }

    @JsonProperty
    public boolean isSuccess()
    {
        return success;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Object getData()
    {
        return data;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public List<String> getColumns()
    {
        return columns;
    }

    @JsonProperty("row_count")
    public long getRowCount()
    {
        return rowCount;
    }

    @JsonProperty("execution_time_ms")
    public double getExecutionTimeMs()
    {
        return executionTimeMs;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExecutionResult that = (ExecutionResult) o;
        return success == that.success &&
                rowCount == that.rowCount &&
                Double.compare(that.executionTimeMs, executionTimeMs) == 0 &&
                Objects.equals(data, that.data) &&
                Objects.equals(columns, that.columns);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(success, data, columns, rowCount, executionTimeMs);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("success", success)
                .add("data", data)
                .add("columns", columns)
                .add("rowCount", rowCount)
                .add("executionTimeMs", executionTimeMs)
                .toString();
    }
}
