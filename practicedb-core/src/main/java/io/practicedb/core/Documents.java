package io.practicedb.core;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for the map-shaped documents the engine stores.
 */
public final class Documents {
    public static final String ID = "id";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    // Fixed millisecond precision keeps timestamps lexicographically ordered.
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final SecureRandom RANDOM = new SecureRandom();

    private Documents() {
    }

    /**
     * Generates {@code <epochMillis>_<9 base-36 chars>}. Unique enough for one process, not across
     * clients with skewed clocks.
     */
    public static String generateId(Clock clock) {
        StringBuilder sb = new StringBuilder(24);
        sb.append(clock.millis()).append('_');
        for (int i = 0; i < 9; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    public static String timestamp(Clock clock) {
        return TIMESTAMP.format(clock.instant());
    }

    public static String idOf(Map<String, Object> document) {
        Object id = document == null ? null : document.get(ID);
        return id == null ? null : String.valueOf(id);
    }

    /**
     * Deep copy of maps and lists; leaves scalars shared since they are immutable.
     */
    @SuppressWarnings("unchecked")
    public static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> copy(Map<String, Object> document) {
        return document == null ? null : (Map<String, Object>) deepCopy(document);
    }

    public static List<Map<String, Object>> copyAll(List<Map<String, Object>> documents) {
        List<Map<String, Object>> copies = new ArrayList<>(documents.size());
        for (Map<String, Object> document : documents) {
            copies.add(copy(document));
        }
        return copies;
    }

    /**
     * Equality used by filters and constraints: numbers compare by value regardless of boxed type.
     */
    public static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return toBigDecimal((Number) a).compareTo(toBigDecimal((Number) b)) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * Orders scalars of the same kind; nulls sort first, mismatched kinds fall back to string order.
     */
    @SuppressWarnings("unchecked")
    public static int compareValues(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return toBigDecimal((Number) a).compareTo(toBigDecimal((Number) b));
        }
        if (a instanceof Comparable && a.getClass().equals(b.getClass())) {
            return ((Comparable<Object>) a).compareTo(b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    /**
     * Numeric view of a field for sums and averages; anything non-numeric counts as 0.
     */
    public static double numericValue(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        return 0;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }
}
