package io.practicedb.core.validation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.Documents;
import io.practicedb.core.PracticeCollections;

/**
 * Collection-specific rules checked by validated writes.
 */
public class BusinessRules {
    public static final double MAX_CLAIM_AMOUNT = 1_000_000;
    public static final double AMOUNT_TOLERANCE = 0.01;

    static final Set<String> PEDIATRIC_PROCEDURES = Set.of("PED-001", "PED-002", "PED-003");
    static final Set<String> GERIATRIC_PROCEDURES = Set.of("GER-001", "GER-002");

    private final DatabaseEngine engine;

    public BusinessRules(DatabaseEngine engine) {
        this.engine = engine;
    }

    /**
     * Runs the rules for {@code collection} against a complete document.
     *
     * @param excludeId id of the document being updated, so it does not conflict with itself
     * @throws ValidationException on the first failed rule
     */
    @SuppressWarnings("unchecked")
    public void apply(String collection, Map<String, Object> document, String excludeId) throws IOException {
        if (PracticeCollections.APPOINTMENTS.equals(collection)) {
            List<Map<String, Object>> conflicts = findAppointmentConflicts(document, excludeId);
            if (!conflicts.isEmpty()) {
                throw new ValidationException("Appointment time conflicts with existing appointments", "time",
                        Map.of("conflicts", conflicts), null);
            }
        } else if (PracticeCollections.CLAIMS.equals(collection)) {
            String patientId = Objects.toString(document.get("patientId"), null);
            RuleResult insurance = validatePatientInsurance(patientId,
                    Objects.toString(document.get("serviceDate"), null));
            if (!insurance.valid()) {
                throw new ValidationException(insurance.error(), "insurance");
            }
            RuleResult amount = validateClaimAmount(document);
            if (!amount.valid()) {
                throw new ValidationException(amount.error(), "amount");
            }
            Map<String, Object> patient = engine.get(PracticeCollections.PATIENTS, patientId);
            Object services = document.get("services");
            if (services instanceof List) {
                for (Object service : (List<Object>) services) {
                    if (service instanceof Map) {
                        Object code = ((Map<String, Object>) service).get("serviceCode");
                        RuleResult age = validatePatientAge(patient, code == null ? null : code.toString());
                        if (!age.valid()) {
                            throw new ValidationException(age.error(), "age");
                        }
                    }
                }
            }
        }
    }

    /**
     * Other non-cancelled appointments of the same doctor on the same date whose interval
     * intersects this one. Times compare as strings, so they must share a format such as HH:mm.
     */
    public List<Map<String, Object>> findAppointmentConflicts(Map<String, Object> appointment, String excludeId)
            throws IOException {
        Object doctorId = appointment.get("doctorId");
        Object date = appointment.get("date");
        Object time = appointment.get("time");
        Object endTime = appointment.get("endTime");
        List<Map<String, Object>> conflicts = new ArrayList<>();
        if (doctorId == null || date == null || time == null || endTime == null) {
            return conflicts;
        }
        for (Map<String, Object> other : engine.getAll(PracticeCollections.APPOINTMENTS)) {
            if (!Objects.equals(other.get("doctorId"), doctorId) || !Objects.equals(other.get("date"), date)) {
                continue;
            }
            if (Objects.equals(Documents.idOf(other), excludeId) || "cancelled".equals(other.get("status"))) {
                continue;
            }
            String otherStart = String.valueOf(other.get("time"));
            String otherEnd = String.valueOf(other.get("endTime"));
            boolean disjoint = otherEnd.compareTo(time.toString()) <= 0 || otherStart.compareTo(endTime.toString()) >= 0;
            if (!disjoint) {
                conflicts.add(other);
            }
        }
        return conflicts;
    }

    @SuppressWarnings("unchecked")
    public RuleResult validatePatientInsurance(String patientId, String serviceDate) throws IOException {
        Map<String, Object> patient = patientId == null ? null : engine.get(PracticeCollections.PATIENTS, patientId);
        if (patient == null) {
            return RuleResult.fail("Patient not found");
        }
        Object insurance = patient.get("insuranceInfo");
        if (!(insurance instanceof Map)) {
            return RuleResult.fail("Patient has no insurance information");
        }
        Map<String, Object> info = (Map<String, Object>) insurance;
        String validFrom = String.valueOf(info.get("validFrom"));
        String validTo = String.valueOf(info.get("validTo"));
        if (serviceDate == null || serviceDate.compareTo(validFrom) < 0 || serviceDate.compareTo(validTo) > 0) {
            return RuleResult.fail("Insurance is not valid for the service date");
        }
        return RuleResult.ok();
    }

    @SuppressWarnings("unchecked")
    public static RuleResult validateClaimAmount(Map<String, Object> claim) {
        Object services = claim.get("services");
        if (!(services instanceof List) || ((List<Object>) services).isEmpty()) {
            return RuleResult.fail("Claim must have at least one service");
        }
        double total = 0;
        for (Object service : (List<Object>) services) {
            if (service instanceof Map) {
                total += Documents.numericValue(((Map<String, Object>) service).get("totalPrice"));
            }
        }
        Object amount = claim.get("amount");
        if (amount instanceof Number && Math.abs(((Number) amount).doubleValue() - total) > AMOUNT_TOLERANCE) {
            return RuleResult.fail("Claim amount does not match services total");
        }
        if (total > MAX_CLAIM_AMOUNT) {
            return RuleResult.fail("Claim amount exceeds maximum of 1000000 SAR");
        }
        return RuleResult.ok();
    }

    /**
     * Pediatric procedure codes need a patient under 18, geriatric ones a patient 65 or older.
     */
    public static RuleResult validatePatientAge(Map<String, Object> patient, String procedureCode) {
        if (patient == null || procedureCode == null || !(patient.get("age") instanceof Number)) {
            return RuleResult.ok();
        }
        double age = ((Number) patient.get("age")).doubleValue();
        if (PEDIATRIC_PROCEDURES.contains(procedureCode) && age >= 18) {
            return RuleResult.fail("Procedure is for pediatric patients only");
        }
        if (GERIATRIC_PROCEDURES.contains(procedureCode) && age < 65) {
            return RuleResult.fail("Procedure is for geriatric patients only");
        }
        return RuleResult.ok();
    }
}
