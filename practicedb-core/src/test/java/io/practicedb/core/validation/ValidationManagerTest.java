package io.practicedb.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.PracticeCollections;
import io.practicedb.core.schema.SchemaRegistry;
import io.practicedb.core.storage.MemoryStorageAdapter;

class ValidationManagerTest {

    private DatabaseEngine engine;
    private ValidationManager validator;

    @BeforeEach
    void setUp() {
        engine = new DatabaseEngine(new MemoryStorageAdapter());
        // structural checks are covered elsewhere; these tests exercise the integrity layer
        validator = new ValidationManager(engine, new SchemaRegistry(), IntegrityRules.defaults());
    }

    private static Map<String, Object> doc(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    @Test
    void shouldBlockDeletingPatientReferencedByAppointment() throws IOException {
        engine.create(PracticeCollections.PATIENTS, doc("id", "p1", "mrn", "MRN-1"));
        engine.create(PracticeCollections.APPOINTMENTS, doc("id", "a1", "patientId", "p1"));

        IntegrityException e = assertThrows(IntegrityException.class,
                () -> validator.deleteValidated(PracticeCollections.PATIENTS, "p1"));

        assertThat(e.getMessage()).isEqualTo("Cannot delete: referenced by appointments");
        assertThat(e.getConstraint()).isEqualTo(IntegrityException.FOREIGN_KEY);
        assertThat(e.getBlockedBy()).containsExactly(PracticeCollections.APPOINTMENTS);
        assertThat(engine.get(PracticeCollections.PATIENTS, "p1")).isNotNull();
    }

    @Test
    void shouldListEveryRestrictingCollection() throws IOException {
        engine.create(PracticeCollections.PATIENTS, doc("id", "p1"));
        engine.create(PracticeCollections.APPOINTMENTS, doc("id", "a1", "patientId", "p1"));
        engine.create(PracticeCollections.CLAIMS, doc("id", "c1", "patientId", "p1"));

        DeleteCheck check = validator.getReferences().checkDeleteConstraints(PracticeCollections.PATIENTS, "p1");

        assertThat(check.canDelete()).isFalse();
        assertThat(check.blockedBy()).containsExactly(PracticeCollections.APPOINTMENTS, PracticeCollections.CLAIMS);
    }

    @Test
    void shouldCascadeDeleteDependentRecords() throws IOException {
        engine.create(PracticeCollections.PATIENTS, doc("id", "p1"));
        engine.create(PracticeCollections.PATIENTS, doc("id", "p2"));
        engine.create(PracticeCollections.MEDICAL_RECORDS, doc("id", "m1", "patientId", "p1"));
        engine.create(PracticeCollections.LAB_RESULTS, doc("id", "l1", "patientId", "p1"));
        engine.create(PracticeCollections.LAB_RESULTS, doc("id", "l2", "patientId", "p2"));

        assertThat(validator.deleteValidated(PracticeCollections.PATIENTS, "p1")).isTrue();

        assertThat(engine.count(PracticeCollections.MEDICAL_RECORDS)).isZero();
        assertThat(engine.getAll(PracticeCollections.LAB_RESULTS)).extracting(d -> d.get("id")).containsExactly("l2");
    }

    @Test
    void shouldNullOutSetNullReferences() throws IOException {
        engine.create(PracticeCollections.APPOINTMENTS, doc("id", "a1"));
        engine.create(PracticeCollections.TELEMEDICINE_SESSIONS, doc("id", "t1", "appointmentId", "a1"));

        assertThat(validator.deleteValidated(PracticeCollections.APPOINTMENTS, "a1")).isTrue();

        Map<String, Object> session = engine.get(PracticeCollections.TELEMEDICINE_SESSIONS, "t1");
        assertThat(session).containsEntry("appointmentId", null);
    }

    @Test
    void shouldRejectDuplicateUniqueValue() throws IOException {
        validator.createValidated(PracticeCollections.PATIENTS, doc("id", "p1", "mrn", "MRN-1"));

        IntegrityException e = assertThrows(IntegrityException.class,
                () -> validator.createValidated(PracticeCollections.PATIENTS, doc("id", "p2", "mrn", "MRN-1")));

        assertThat(e.getConstraint()).isEqualTo(IntegrityException.UNIQUE);
        assertThat(e.getViolations()).containsExactly("mrn must be unique");
        assertThat(engine.count(PracticeCollections.PATIENTS)).isEqualTo(1);
    }

    @Test
    void shouldSkipUniqueCheckForMissingValuesAndSelf() throws IOException {
        validator.createValidated(PracticeCollections.PATIENTS, doc("id", "p1", "mrn", "MRN-1"));
        validator.createValidated(PracticeCollections.PATIENTS, doc("id", "p2", "mrn", "MRN-2"));

        assertThat(validator.checkUniqueConstraints(PracticeCollections.PATIENTS, doc("mrn", "MRN-1"), "p1")).isEmpty();
        assertThat(validator.updateValidated(PracticeCollections.PATIENTS, "p1", doc("mrn", "MRN-1"))).isNotNull();
        assertThrows(IntegrityException.class,
                () -> validator.updateValidated(PracticeCollections.PATIENTS, "p2", doc("mrn", "MRN-1")));
    }

    @Test
    void shouldRejectMissingReferenceOnCreate() {
        IntegrityException e = assertThrows(IntegrityException.class,
                () -> validator.createValidated(PracticeCollections.LAB_RESULTS, doc("patientId", "ghost")));

        assertThat(e.getConstraint()).isEqualTo(IntegrityException.FOREIGN_KEY);
        assertThat(e.getDetails()).containsEntry("patientId", "ghost");
    }

    @Test
    void shouldReturnNullWhenUpdatingMissingDocument() throws IOException {
        assertThat(validator.updateValidated(PracticeCollections.PATIENTS, "missing", doc("mrn", "x"))).isNull();
    }

    @Test
    void shouldRejectOverlappingAppointmentForSameDoctor() throws IOException {
        engine.create(PracticeCollections.APPOINTMENTS, doc("id", "a1", "doctorId", "d1", "date", "2024-03-01",
                "time", "09:00", "endTime", "09:30", "status", "confirmed"));
        engine.create(PracticeCollections.APPOINTMENTS, doc("id", "a2", "doctorId", "d1", "date", "2024-03-01",
                "time", "11:00", "endTime", "11:30", "status", "cancelled"));

        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.createValidated(PracticeCollections.APPOINTMENTS, doc("doctorId", "d1",
                        "date", "2024-03-01", "time", "09:15", "endTime", "09:45")));
        assertThat(e.getField()).isEqualTo("time");

        // touching intervals and cancelled slots are free
        validator.createValidated(PracticeCollections.APPOINTMENTS, doc("doctorId", "d1", "date", "2024-03-01",
                "time", "09:30", "endTime", "10:00"));
        validator.createValidated(PracticeCollections.APPOINTMENTS, doc("doctorId", "d1", "date", "2024-03-01",
                "time", "11:00", "endTime", "11:30"));
        assertThat(engine.count(PracticeCollections.APPOINTMENTS)).isEqualTo(4);
    }

    @Test
    void shouldAllowMovingAppointmentWithinItsOwnSlot() throws IOException {
        engine.create(PracticeCollections.APPOINTMENTS, doc("id", "a1", "doctorId", "d1", "date", "2024-03-01",
                "time", "09:00", "endTime", "09:30"));

        Map<String, Object> updated = validator.updateValidated(PracticeCollections.APPOINTMENTS, "a1",
                doc("time", "09:10", "endTime", "09:40"));

        assertThat(updated).containsEntry("time", "09:10");
    }

    @Test
    void shouldCheckClaimInsuranceBeforeAmount() throws IOException {
        engine.create(PracticeCollections.PATIENTS, doc("id", "p1", "age", 30));
        engine.create(PracticeCollections.PATIENTS, doc("id", "p2", "age", 30, "insuranceInfo",
                doc("validFrom", "2024-01-01", "validTo", "2024-12-31")));

        ValidationException noInsurance = assertThrows(ValidationException.class,
                () -> validator.createValidated(PracticeCollections.CLAIMS, claim("p1", "2024-03-01", 100, 100)));
        assertThat(noInsurance.getField()).isEqualTo("insurance");

        ValidationException expired = assertThrows(ValidationException.class,
                () -> validator.createValidated(PracticeCollections.CLAIMS, claim("p2", "2025-01-15", 100, 100)));
        assertThat(expired.getField()).isEqualTo("insurance");

        ValidationException mismatch = assertThrows(ValidationException.class,
                () -> validator.createValidated(PracticeCollections.CLAIMS, claim("p2", "2024-03-01", 150, 100)));
        assertThat(mismatch.getField()).isEqualTo("amount");

        assertThat(validator.createValidated(PracticeCollections.CLAIMS, claim("p2", "2024-03-01", 100.005, 100)))
                .containsKey("id");
    }

    @Test
    void shouldRejectAgeRestrictedProcedure() throws IOException {
        engine.create(PracticeCollections.PATIENTS, doc("id", "p1", "age", 40, "insuranceInfo",
                doc("validFrom", "2024-01-01", "validTo", "2024-12-31")));
        Map<String, Object> claim = claim("p1", "2024-03-01", 100, 100);
        claim.put("services", List.of(doc("serviceCode", "PED-001", "totalPrice", 100)));

        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.createValidated(PracticeCollections.CLAIMS, claim));

        assertThat(e.getField()).isEqualTo("age");
    }

    @Test
    void shouldReportRuleFailureForNonStringClaimFieldsOnUpdate() throws IOException {
        engine.create(PracticeCollections.PATIENTS, doc("id", "p2", "age", 30, "insuranceInfo",
                doc("validFrom", "2024-01-01", "validTo", "2024-12-31")));
        engine.create(PracticeCollections.CLAIMS, doc("id", "c1", "patientId", "p2", "serviceDate", 20240301,
                "amount", 100, "services", List.of(doc("serviceCode", "CONS-001", "totalPrice", 100))));
        engine.create(PracticeCollections.CLAIMS, doc("id", "c2", "patientId", 2, "serviceDate", "2024-03-01",
                "amount", 100, "services", List.of(doc("serviceCode", "CONS-001", "totalPrice", 100))));

        ValidationException badDate = assertThrows(ValidationException.class,
                () -> validator.updateValidated(PracticeCollections.CLAIMS, "c1", doc("amount", 100)));
        assertThat(badDate.getMessage()).isEqualTo("Insurance is not valid for the service date");

        ValidationException badPatient = assertThrows(ValidationException.class,
                () -> validator.updateValidated(PracticeCollections.CLAIMS, "c2", doc("amount", 100)));
        assertThat(badPatient.getMessage()).isEqualTo("Patient not found");
    }

    @Test
    void shouldLimitClaimTotals() {
        assertThat(BusinessRules.validateClaimAmount(doc("services", List.of())).valid()).isFalse();
        assertThat(BusinessRules.validateClaimAmount(doc("amount", 2_000_000,
                "services", List.of(doc("totalPrice", 2_000_000)))).error())
                .isEqualTo("Claim amount exceeds maximum of 1000000 SAR");
        assertThat(BusinessRules.validatePatientAge(doc("age", 70), "GER-001").valid()).isTrue();
        assertThat(BusinessRules.validatePatientAge(doc("age", 60), "GER-001").valid()).isFalse();
    }

    private static Map<String, Object> claim(String patientId, String serviceDate, Object amount, Object servicesTotal) {
        return doc("patientId", patientId, "serviceDate", serviceDate, "amount", amount,
                "services", List.of(doc("serviceCode", "CONS-001", "totalPrice", servicesTotal)));
    }
}
