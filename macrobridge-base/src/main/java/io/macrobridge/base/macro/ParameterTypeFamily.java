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

import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Groups DuckDB type tags by the way an untyped request value is converted for them.
 */
public enum ParameterTypeFamily
{
    INTEGER("INTEGER", "BIGINT", "INT", "SMALLINT", "TINYINT"),
    FLOATING("DOUBLE", "REAL", "FLOAT", "DECIMAL", "NUMERIC"),
    STRING("VARCHAR", "TEXT", "STRING", "CHAR"),
    BOOLEAN("BOOLEAN", "BOOL"),
    DATE("DATE"),
    TIMESTAMP("TIMESTAMP", "TIME"),
    JSON("JSON", "ARRAY", "LIST"),
    UNKNOWN;

    private final Set<String> typeTags;

    ParameterTypeFamily(String... typeTags)
    {
        this.typeTags = ImmutableSet.copyOf(typeTags);
    }

    public static ParameterTypeFamily fromTypeTag(String typeTag)
    {
        if (typeTag == null) {
            return UNKNOWN;
        }
        String normalized = typeTag.trim().toUpperCase(Locale.ROOT);
        // INTEGER[], VARCHAR[3]
        if (normalized.endsWith("]")) {
            return JSON;
        }
        // DECIMAL(18,3), VARCHAR(25)
        int precision = normalized.indexOf('(');
        if (precision > 0) {
            normalized = normalized.substring(0, precision).trim();
        }
        String baseType = normalized;
        return Arrays.stream(values())
                .filter(family -> family.typeTags.contains(baseType))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
