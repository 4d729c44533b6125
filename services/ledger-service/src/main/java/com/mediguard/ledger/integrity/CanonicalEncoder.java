package com.mediguard.ledger.integrity;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic JSON encoding for hashing.
 *
 * <p>Output depends on logical content only: map keys are sorted at every depth,
 * lists keep their order, every number is written as its shortest plain decimal
 * ({@code 1}, {@code 1.0} and {@code 1.00} all become {@code 1}) and timestamps use
 * one fixed UTC pattern. Numbers are never rounded, so any change to a stored value
 * changes the output. Unordered collections are rejected.
 */
@Component
public class CanonicalEncoder {

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    public byte[] encode(Object value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(out, JsonEncoding.UTF8)) {
            write(generator, value);
        } catch (IOException e) {
            throw new UncheckedIOException("Canonical encoding failed", e);
        }
        return out.toByteArray();
    }

    public String encodeToString(Object value) {
        return new String(encode(value), StandardCharsets.UTF_8);
    }

    public static String formatTimestamp(Instant timestamp) {
        return TIMESTAMP_FORMAT.format(timestamp);
    }

    /**
     * Shortest plain decimal with the same numeric value. Never rounds.
     */
    public String formatNumber(Number number) {
        BigDecimal decimal = toBigDecimal(number);
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }

    private void write(JsonGenerator generator, Object value) throws IOException {
        if (value == null) {
            generator.writeNull();
        } else if (value instanceof Map<?, ?> map) {
            writeObject(generator, map);
        } else if (value instanceof List<?> list) {
            generator.writeStartArray();
            for (Object element : list) {
                write(generator, element);
            }
            generator.writeEndArray();
        } else if (value instanceof Collection<?> collection) {
            // no stable iteration order to hash
            throw new IllegalArgumentException("Unordered collection cannot be canonically encoded: "
                    + collection.getClass().getName());
        } else if (value instanceof Object[] array) {
            write(generator, Arrays.asList(array));
        } else if (value instanceof CharSequence text) {
            generator.writeString(text.toString());
        } else if (value instanceof Boolean flag) {
            generator.writeBoolean(flag);
        } else if (value instanceof Number number) {
            generator.writeNumber(formatNumber(number));
        } else if (value instanceof Instant instant) {
            generator.writeString(formatTimestamp(instant));
        } else if (value instanceof Enum<?> constant) {
            generator.writeString(constant.name());
        } else {
            // beans and other value types go through their plain JSON tree first
            write(generator, objectMapper.convertValue(value, Object.class));
        }
    }

    private void writeObject(JsonGenerator generator, Map<?, ?> map) throws IOException {
        TreeMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (sorted.put(key, entry.getValue()) != null) {
                throw new IllegalArgumentException("Duplicate key after string conversion: " + key);
            }
        }
        generator.writeStartObject();
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            generator.writeFieldName(entry.getKey());
            write(generator, entry.getValue());
        }
        generator.writeEndObject();
    }

    private BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Non-finite number cannot be canonically encoded: " + number);
            }
        }
        return new BigDecimal(number.toString());
    }
}
