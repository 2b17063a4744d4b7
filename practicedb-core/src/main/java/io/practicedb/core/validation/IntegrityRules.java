package io.practicedb.core.validation;

import java.util.ArrayList;
import java.util.List;

import io.practicedb.core.PracticeCollections;

/**
 * Static table of unique and reference constraints.
 */
public class IntegrityRules {

    private final List<UniqueConstraint> uniqueConstraints;
    private final List<ReferenceConstraint> referenceConstraints;

    public IntegrityRules(List<UniqueConstraint> uniqueConstraints, List<ReferenceConstraint> referenceConstraints) {
        this.uniqueConstraints = List.copyOf(uniqueConstraints);
        this.referenceConstraints = List.copyOf(referenceConstraints);
    }

    public static IntegrityRules defaults() {
        return new IntegrityRules(
                List.of(
                        UniqueConstraint.of(PracticeCollections.PATIENTS, "mrn"),
                        UniqueConstraint.of(PracticeCollections.PATIENTS, "nationalId"),
                        UniqueConstraint.of(PracticeCollections.CLAIMS, "claimNumber"),
                        UniqueConstraint.of(PracticeCollections.USERS, "email"),
                        UniqueConstraint.of(PracticeCollections.USERS, "githubId")),
                List.of(
                        new ReferenceConstraint(PracticeCollections.APPOINTMENTS, "patientId",
                                PracticeCollections.PATIENTS, OnDelete.RESTRICT, OnUpdate.CASCADE),
                        new ReferenceConstraint(PracticeCollections.MEDICAL_RECORDS, "patientId",
                                PracticeCollections.PATIENTS, OnDelete.CASCADE, OnUpdate.CASCADE),
                        new ReferenceConstraint(PracticeCollections.LAB_RESULTS, "patientId",
                                PracticeCollections.PATIENTS, OnDelete.CASCADE, OnUpdate.CASCADE),
                        new ReferenceConstraint(PracticeCollections.CLAIMS, "patientId",
                                PracticeCollections.PATIENTS, OnDelete.RESTRICT, OnUpdate.CASCADE),
                        new ReferenceConstraint(PracticeCollections.TELEMEDICINE_SESSIONS, "appointmentId",
                                PracticeCollections.APPOINTMENTS, OnDelete.SET_NULL, OnUpdate.CASCADE)));
    }

    public List<UniqueConstraint> getUniqueConstraints() {
        return uniqueConstraints;
    }

    public List<ReferenceConstraint> getReferenceConstraints() {
        return referenceConstraints;
    }

    public List<UniqueConstraint> uniqueConstraintsFor(String collection) {
        List<UniqueConstraint> result = new ArrayList<>();
        for (UniqueConstraint constraint : uniqueConstraints) {
            if (constraint.collection().equals(collection)) {
                result.add(constraint);
            }
        }
        return result;
    }

    /**
     * Constraints whose source is {@code collection}, i.e. the references it holds.
     */
    public List<ReferenceConstraint> referencesFrom(String collection) {
        List<ReferenceConstraint> result = new ArrayList<>();
        for (ReferenceConstraint constraint : referenceConstraints) {
            if (constraint.sourceCollection().equals(collection)) {
                result.add(constraint);
            }
        }
        return result;
    }

    /**
     * Constraints whose target is {@code collection}, i.e. the references pointing at it.
     */
    public List<ReferenceConstraint> referencesTo(String collection) {
        List<ReferenceConstraint> result = new ArrayList<>();
        for (ReferenceConstraint constraint : referenceConstraints) {
            if (constraint.targetCollection().equals(collection)) {
                result.add(constraint);
            }
        }
        return result;
    }
}
