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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableSet;
import io.airlift.log.Logger;
import io.macrobridge.base.MacroParameterException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Validates the untyped parameters of one invocation against a {@link MacroDescriptor} and converts
 * every supplied value to the family of its declared type.
 */
public class MacroParameterCoercer
{
    private static final Logger LOG = Logger.get(MacroParameterCoercer.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Set<String> NULL_TOKENS = ImmutableSet.of("", "null", "none");
    private static final Set<String> TRUE_TOKENS = ImmutableSet.of("true", "1", "yes", "on", "t", "y");
    private static final Set<String> FALSE_TOKENS = ImmutableSet.of("false", "0", "no", "off", "f", "n");

    private static final Pattern DATE_SHAPE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{4}");
    private static final Pattern INTEGER_SHAPE = Pattern.compile("-?\\d+");
    private static final Pattern FLOATING_SHAPE = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    public CoercedParameters validate(MacroDescriptor descriptor, Map<String, ?> rawParameters)
    {
        requireNonNull(descriptor, "descriptor is null");
        requireNonNull(rawParameters, "rawParameters is null");

        List<String> declared = descriptor.getParameters();
        long provided = rawParameters.values().stream().filter(Objects::nonNull).count();
        if (provided > declared.size()) {
            throw new MacroParameterException(format("Too many parameters. Expected %s, got %s", declared.size(), provided));
        }
        for (Map.Entry<String, ?> entry : rawParameters.entrySet()) {
            if (entry.getValue() != null && !declared.contains(entry.getKey())) {
                throw new MacroParameterException(
                        format("Unknown parameter '%s' for macro '%s'", entry.getKey(), descriptor.getName()),
                        entry.getKey(),
                        null,
                        entry.getValue());
            }
        }

        Map<String, Object> validated = new LinkedHashMap<>();
        String firstOmitted = null;
        for (int i = 0; i < declared.size(); i++) {
            String name = declared.get(i);
            String type = descriptor.getParameterTypes().get(i);
            Object value = rawParameters.get(name);
            if (value == null) {
                if (firstOmitted == null) {
                    firstOmitted = name;
                }
                continue;
            }
            // arguments bind positionally, a gap would shift every later value
            if (firstOmitted != null) {
                throw new MacroParameterException(
                        format("Parameter '%s' is required because the later parameter '%s' is supplied", firstOmitted, name),
                        firstOmitted,
                        descriptor.getParameterTypes().get(descriptor.getParameterIndex(firstOmitted)),
                        null);
            }
            try {
                validated.put(name, coerce(value, type));
            }
            catch (IllegalArgumentException e) {
                throw new MacroParameterException(
                        format("Invalid value for parameter '%s': %s", name, e.getMessage()),
                        name,
                        type,
                        value,
                        e);
            }
        }
        return new CoercedParameters(descriptor, validated);
    }

    /**
     * Converts one value to the family of {@code typeTag}.
     *
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public Object coerce(Object value, String typeTag)
    {
        if (value == null) {
            return null;
        }
        if (value instanceof String && ((String) value).isBlank()) {
            return null;
        }

        switch (ParameterTypeFamily.fromTypeTag(typeTag)) {
            case INTEGER:
                return toInteger(value, typeTag);
            case FLOATING:
                return toFloating(value, typeTag);
            case STRING:
                return toText(value);
            case BOOLEAN:
                return toBoolean(value);
            case DATE:
                return toTemporalText(value, true);
            case TIMESTAMP:
                return toTemporalText(value, false);
            case JSON:
                return toStructured(value);
            case UNKNOWN:
            default:
                return sniff(value, typeTag);
        }
    }

    private static Long toInteger(Object value, String typeTag)
    {
        BigDecimal decimal;
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (isNullToken(text)) {
                return null;
            }
            decimal = parseDecimal(text, typeTag);
        }
        else if (value instanceof BigDecimal) {
            decimal = (BigDecimal) value;
        }
        else if (value instanceof BigInteger) {
            decimal = new BigDecimal((BigInteger) value);
        }
        else if (value instanceof Double || value instanceof Float) {
            double doubleValue = ((Number) value).doubleValue();
            if (!Double.isFinite(doubleValue)) {
                throw new IllegalArgumentException(format("Cannot convert '%s' to %s", value, typeTag));
            }
            decimal = BigDecimal.valueOf(doubleValue);
        }
        else if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        else {
            throw new IllegalArgumentException(format("Cannot convert '%s' to %s", value, typeTag));
        }

        try {
            return decimal.setScale(0, RoundingMode.DOWN).longValueExact();
        }
        catch (ArithmeticException e) {
            throw new IllegalArgumentException(format("Cannot convert '%s' to %s: value out of range", value, typeTag), e);
        }
    }

    private static BigDecimal parseDecimal(String text, String typeTag)
    {
        try {
            return new BigDecimal(text);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(format("Cannot convert '%s' to %s", text, typeTag), e);
        }
    }

    private static Double toFloating(Object value, String typeTag)
    {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (!(value instanceof String)) {
            throw new IllegalArgumentException(format("Cannot convert '%s' to %s", value, typeTag));
        }
        String text = ((String) value).trim();
        if (isNullToken(text)) {
            return null;
        }
        // Double.parseDouble alone would accept Java literals such as 0x1p3 or 1d
        if (!FLOATING_SHAPE.matcher(text).matches()) {
            throw new IllegalArgumentException(format("Cannot convert '%s' to %s", text, typeTag));
        }
        try {
            return Double.parseDouble(text);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(format("Cannot convert '%s' to %s", text, typeTag), e);
        }
    }

    private static String toText(Object value)
    {
        if (value instanceof Map || value instanceof List) {
            return toJson(value);
        }
        return String.valueOf(value);
    }

    private static Boolean toBoolean(Object value)
    {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String || value instanceof Number) {
            String token = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
            if (TRUE_TOKENS.contains(token)) {
                return true;
            }
            if (FALSE_TOKENS.contains(token)) {
                return false;
            }
        }
        throw new IllegalArgumentException(format("Cannot convert '%s' to boolean", value));
    }

    private static String toTemporalText(Object value, boolean isDate)
    {
        String text = String.valueOf(value).trim();
        if (isNullToken(text)) {
            return null;
        }
        if (isDate && !DATE_SHAPE.matcher(text).lookingAt()) {
            throw new IllegalArgumentException(format("Invalid date format: %s. Expected YYYY-MM-DD or MM/DD/YYYY", text));
        }
        // the engine parses the text itself
        return text;
    }

    private static Object toStructured(Object value)
    {
        if (!(value instanceof String)) {
            return value;
        }
        try {
            return OBJECT_MAPPER.readValue((String) value, Object.class);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException(format("Invalid JSON format: %s", value), e);
        }
    }

    private static Object sniff(Object value, String typeTag)
    {
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (INTEGER_SHAPE.matcher(text).matches()) {
                try {
                    return Long.parseLong(text);
                }
                catch (NumberFormatException ignored) {
                    // wider than BIGINT, try it as a floating value
                }
            }
            String lowerCase = text.toLowerCase(Locale.ROOT);
            if ((lowerCase.contains(".") || lowerCase.contains("e")) && FLOATING_SHAPE.matcher(text).matches()) {
                return Double.parseDouble(text);
            }
        }
        LOG.warn("Unknown parameter type %s, passing value as-is", typeTag);
        return value;
    }

    private static boolean isNullToken(String text)
    {
        return NULL_TOKENS.contains(text.toLowerCase(Locale.ROOT));
    }

    public static String toJson(Object value)
    {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException(format("Cannot serialize '%s' as JSON", value), e);
        }
    }
}
