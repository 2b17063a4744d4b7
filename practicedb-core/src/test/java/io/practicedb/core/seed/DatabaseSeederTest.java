package io.practicedb.core.seed;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.MutableClock;
import io.practicedb.core.PracticeCollections;
import io.practicedb.core.storage.MemoryStorageAdapter;
import io.practicedb.core.sync.SyncLog;
import io.practicedb.core.validation.IntegrityChecker;
import io.practicedb.core.validation.IntegrityReport;
import io.practicedb.core.validation.IntegrityRules;

class DatabaseSeederTest {

    private DatabaseEngine engine;
    private DatabaseSeeder seeder;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2024-03-10T12:00:00Z");
        engine = new DatabaseEngine(new MemoryStorageAdapter(), clock, Duration.ofMinutes(5), SyncLog.DEFAULT_CAPACITY);
        seeder = new DatabaseSeeder(engine);
    }

    @Test
    void shouldSeedFixturesInDependencyOrder() throws IOException {
        Map<String, Integer> seeded = seeder.seed(false);

        assertThat(seeded).containsExactly(
                Map.entry(PracticeCollections.PATIENTS, 6),
                Map.entry(PracticeCollections.APPOINTMENTS, 5),
                Map.entry(PracticeCollections.CLAIMS, 4),
                Map.entry(PracticeCollections.NOTIFICATIONS, 4));
        assertThat(engine.getMetadata().count(PracticeCollections.PATIENTS)).isEqualTo(6);
    }

    @Test
    void shouldResolveRelativeDates() throws IOException {
        seeder.seed(false);

        assertThat(engine.get(PracticeCollections.APPOINTMENTS, "apt_1")).containsEntry("date", "2024-03-10");
        assertThat(engine.get(PracticeCollections.APPOINTMENTS, "apt_4")).containsEntry("date", "2024-03-11");
        assertThat(engine.get(PracticeCollections.APPOINTMENTS, "apt_5")).containsEntry("date", "2024-03-12");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> reminders = (List<Map<String, Object>>) engine
                .get(PracticeCollections.APPOINTMENTS, "apt_1").get("reminders");
        assertThat(reminders.get(0)).containsEntry("scheduledFor", "2024-03-09");
    }

    @Test
    void shouldSkipWhenPatientsExistUnlessForced() throws IOException {
        seeder.seed(false);
        engine.create(PracticeCollections.MEDICAL_RECORDS, Map.of("id", "m1", "patientId", "patient_1"));

        assertThat(seeder.seed(false)).isEmpty();
        assertThat(engine.count(PracticeCollections.MEDICAL_RECORDS)).isEqualTo(1);

        assertThat(seeder.seed(true)).containsEntry(PracticeCollections.PATIENTS, 6);
        assertThat(engine.count(PracticeCollections.PATIENTS)).isEqualTo(6);
        assertThat(engine.count(PracticeCollections.MEDICAL_RECORDS)).isZero();
    }

    @Test
    void shouldProduceReferentiallyConsistentData() throws IOException {
        seeder.seed(false);

        List<IntegrityReport> reports = new IntegrityChecker(engine, IntegrityRules.defaults()).runFullIntegrityCheck();

        assertThat(reports).allMatch(IntegrityReport::isClean);
    }
}
