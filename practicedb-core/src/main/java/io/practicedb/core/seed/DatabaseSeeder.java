package io.practicedb.core.seed;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.Documents;
import io.practicedb.core.PracticeCollections;
import io.practicedb.core.query.Where;

/**
 * Loads sample fixtures from {@code /seed/<collection>.json} on the classpath.
 * <p>
 * String values may use {@code {{today}}}, {@code {{today+N}}}, {@code {{today-N}}} for dates
 * relative to the engine clock and {@code {{now}}} for the current timestamp.
 */
public class DatabaseSeeder {
    private static final Logger LOGGER = Logger.getLogger(DatabaseSeeder.class.getName());

    /** Seeding order: referenced collections first. */
    public static final List<String> SEED_ORDER = List.of(PracticeCollections.PATIENTS,
            PracticeCollections.APPOINTMENTS, PracticeCollections.CLAIMS, PracticeCollections.NOTIFICATIONS);

    static final List<String> CLEARED_ON_FORCE = List.of(PracticeCollections.PATIENTS,
            PracticeCollections.APPOINTMENTS, PracticeCollections.CLAIMS, PracticeCollections.NOTIFICATIONS,
            PracticeCollections.MEDICAL_RECORDS, PracticeCollections.LAB_RESULTS);

    private static final Pattern TODAY = Pattern.compile("\\{\\{today(?:([+-])(\\d+))?\\}\\}");
    private static final String NOW = "{{now}}";
    private static final TypeReference<List<Map<String, Object>>> FIXTURE_TYPE = new TypeReference<List<Map<String, Object>>>() {
    };

    private final DatabaseEngine engine;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String resourceRoot;

    public DatabaseSeeder(DatabaseEngine engine) {
        this(engine, "/seed/");
    }

    public DatabaseSeeder(DatabaseEngine engine, String resourceRoot) {
        this.engine = engine;
        this.resourceRoot = resourceRoot.endsWith("/") ? resourceRoot : resourceRoot + "/";
    }

    /**
     * Seeds when the patients collection is empty, or always when {@code force} is set. Forced
     * seeding first clears the seeded collections and the records that depend on them.
     *
     * @return documents created per collection; empty when nothing was seeded
     */
    public Map<String, Integer> seed(boolean force) throws IOException {
        Map<String, Integer> created = new LinkedHashMap<>();
        if (engine.count(PracticeCollections.PATIENTS) > 0 && !force) {
            LOGGER.info("Database already has data. Use force to reseed.");
            return created;
        }
        if (force) {
            for (String collection : CLEARED_ON_FORCE) {
                engine.deleteMany(collection, Where.all());
            }
        }
        for (String collection : SEED_ORDER) {
            List<Map<String, Object>> fixtures = loadFixtures(collection);
            engine.createMany(collection, fixtures);
            created.put(collection, fixtures.size());
            LOGGER.info(() -> "Seeded " + fixtures.size() + " " + collection);
        }
        engine.updateStatistics();
        LOGGER.info("Database seeded successfully");
        return created;
    }

    List<Map<String, Object>> loadFixtures(String collection) throws IOException {
        String resource = resourceRoot + collection + ".json";
        try (InputStream in = DatabaseSeeder.class.getResourceAsStream(resource)) {
            if (in == null) {
                LOGGER.warning(() -> "No seed fixture " + resource);
                return new ArrayList<>();
            }
            List<Map<String, Object>> fixtures = mapper.readValue(in, FIXTURE_TYPE);
            List<Map<String, Object>> resolved = new ArrayList<>(fixtures.size());
            for (Map<String, Object> fixture : fixtures) {
                resolved.add(resolvePlaceholders(fixture));
            }
            return resolved;
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> resolvePlaceholders(Map<String, Object> fixture) {
        return (Map<String, Object>) resolve(fixture);
    }

    @SuppressWarnings("unchecked")
    private Object resolve(Object value) {
        if (value instanceof Map) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                result.put(entry.getKey(), resolve(entry.getValue()));
            }
            return result;
        }
        if (value instanceof List) {
            List<Object> result = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                result.add(resolve(item));
            }
            return result;
        }
        if (value instanceof String) {
            return resolveString((String) value);
        }
        return value;
    }

    private String resolveString(String text) {
        Clock clock = engine.getClock();
        if (NOW.equals(text)) {
            return Documents.timestamp(clock);
        }
        Matcher matcher = TODAY.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        matcher.reset();
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        while (matcher.find()) {
            long days = matcher.group(2) == null ? 0 : Long.parseLong(matcher.group(2));
            if ("-".equals(matcher.group(1))) {
                days = -days;
            }
            matcher.appendReplacement(sb, today.plusDays(days).toString());
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
