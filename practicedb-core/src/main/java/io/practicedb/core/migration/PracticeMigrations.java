package io.practicedb.core.migration;

import java.util.List;

import io.practicedb.core.PracticeCollections;

/**
 * Index migrations for the practice collections.
 */
public final class PracticeMigrations {
    public static final String INDEX_PATIENT_MRN = "idx_patient_mrn";
    public static final String INDEX_PATIENT_NATIONAL_ID = "idx_patient_national_id";
    public static final String INDEX_APPOINTMENT_DATE = "idx_appointment_date";
    public static final String INDEX_APPOINTMENT_PATIENT = "idx_appointment_patient";
    public static final String INDEX_CLAIM_NUMBER = "idx_claim_number";
    public static final String INDEX_CLAIM_STATUS = "idx_claim_status";

    private PracticeMigrations() {
    }

    public static List<Migration> all() {
        return List.of(
                new Migration("1.0.0", "initial_schema",
                        engine -> {
                            engine.createIndex(PracticeCollections.PATIENTS, "mrn", INDEX_PATIENT_MRN);
                            engine.createIndex(PracticeCollections.APPOINTMENTS, "date", INDEX_APPOINTMENT_DATE);
                            engine.createIndex(PracticeCollections.CLAIMS, "status", INDEX_CLAIM_STATUS);
                        },
                        engine -> {
                            engine.dropIndex(INDEX_PATIENT_MRN);
                            engine.dropIndex(INDEX_APPOINTMENT_DATE);
                            engine.dropIndex(INDEX_CLAIM_STATUS);
                        }),
                new Migration("1.1.0", "add_patient_national_id_index",
                        engine -> engine.createIndex(PracticeCollections.PATIENTS, "nationalId",
                                INDEX_PATIENT_NATIONAL_ID),
                        engine -> engine.dropIndex(INDEX_PATIENT_NATIONAL_ID)),
                new Migration("1.2.0", "add_lookup_indexes",
                        engine -> {
                            engine.createIndex(PracticeCollections.APPOINTMENTS, "patientId",
                                    INDEX_APPOINTMENT_PATIENT);
                            engine.createIndex(PracticeCollections.CLAIMS, "claimNumber", INDEX_CLAIM_NUMBER);
                        },
                        engine -> {
                            engine.dropIndex(INDEX_APPOINTMENT_PATIENT);
                            engine.dropIndex(INDEX_CLAIM_NUMBER);
                        }));
    }
}
