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

package io.macrobridge.main.web.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;

public class HealthDto
{
    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    private final String status;
    private final boolean databaseConnected;
    private final String timestamp;
    private final String version;

    public static HealthDto of(boolean databaseConnected, String timestamp, String version)
    {
        return new HealthDto(databaseConnected ? HEALTHY : UNHEALTHY, databaseConnected, timestamp, version);
    }

    @JsonCreator
    public HealthDto(
            @JsonProperty("status") String status,
            @JsonProperty("database_connected") boolean databaseConnected,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("version") String version)
    {
        this.status = status;
        this.databaseConnected = databaseConnected;
        this.timestamp = timestamp;
        this.version = version;
    }

    @JsonProperty
    public String getStatus()
    {
        return status;
    }

    @JsonProperty("database_connected")
    public boolean isDatabaseConnected()
    {
        return databaseConnected;
    }

    @JsonProperty
    public String getTimestamp()
    {
        return timestamp;
    }

    @JsonProperty
    public String getVersion()
    {
        return version;
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
        HealthDto healthDto = (HealthDto) o;
        return databaseConnected == healthDto.databaseConnected &&
                Objects.equals(status, healthDto.status) &&
                Objects.equals(timestamp, healthDto.timestamp) &&
                Objects.equals(version, healthDto.version);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(status, databaseConnected, timestamp, version);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("status", status)
                .add("databaseConnected", databaseConnected)
                .add("timestamp", timestamp)
                .add("version", version)
                .toString();
    }
}
