package io.practicedb.core;

import java.util.List;

/**
 * Names of the practice-management collections. Statistics, schemas and seeding cover these.
 */
public final class PracticeCollections {
    public static final String PATIENTS = "patients";
    public static final String APPOINTMENTS = "appointments";
    public static final String CLAIMS = "claims";
    public static final String PRE_AUTHORIZATIONS = "pre_authorizations";
    public static final String MEDICAL_RECORDS = "medical_records";
    public static final String LAB_RESULTS = "lab_results";
    public static final String NOTIFICATIONS = "notifications";
    public static final String USERS = "users";
    public static final String MESSAGES = "messages";
    public static final String CONVERSATIONS = "conversations";
    public static final String TELEMEDICINE_SESSIONS = "telemedicine_sessions";

    public static final List<String> ALL = List.of(PATIENTS, APPOINTMENTS, CLAIMS, PRE_AUTHORIZATIONS,
            MEDICAL_RECORDS, LAB_RESULTS, NOTIFICATIONS, USERS, MESSAGES, CONVERSATIONS, TELEMEDICINE_SESSIONS);

    /**
     * Collections holding protected health information; encrypted at rest when a key is configured.
     */
    public static final List<String> SENSITIVE = List.of(PATIENTS, MEDICAL_RECORDS, LAB_RESULTS, MESSAGES);

    private PracticeCollections() {
    }
}
