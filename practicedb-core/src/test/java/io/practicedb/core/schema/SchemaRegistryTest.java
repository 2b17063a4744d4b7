package io.practicedb.core.schema;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.practicedb.core.PracticeCollections;

class SchemaRegistryTest {

    @Test
    void shouldRegisterEveryPracticeCollection() {
        SchemaRegistry registry = SchemaRegistry.withDefaults();

        assertThat(registry.getCollections()).containsExactlyInAnyOrderElementsOf(PracticeCollections.ALL);
    }

    @Test
    void shouldPassThroughCollectionsWithoutSchema() {
        SchemaRegistry registry = new SchemaRegistry();

        ValidationResult result = registry.validate("scratch", Map.of("anything", 1));

        assertThat(result.isValid()).isTrue();
        assertThat(result.value()).containsEntry("anything", 1);
    }

    @Test
    void shouldValidateLabResultAgainstDefaults() {
        SchemaRegistry registry = SchemaRegistry.withDefaults();
        Map<String, Object> labResult = new LinkedHashMap<>();
        labResult.put("id", "lab_1");
        labResult.put("patientId", "patient_1");
        labResult.put("testName", "HbA1c");
        labResult.put("result", "7.2");
        labResult.put("normalRange", "4.0-5.6");
        labResult.put("status", "abnormal");
        labResult.put("date", "2024-03-01");

        assertThat(registry.validate(PracticeCollections.LAB_RESULTS, labResult).isValid()).isTrue();

        labResult.put("status", "unknown");
        ValidationResult invalid = registry.validate(PracticeCollections.LAB_RESULTS, labResult);
        assertThat(invalid.errors()).extracting(FieldError::path).containsExactly("status");
    }

    @Test
    void shouldRequireClaimCurrencyToBeSar() {
        ValidationResult result = SchemaRegistry.withDefaults()
                .validatePartial(PracticeCollections.CLAIMS, Map.of("currency", "USD"));

        assertThat(result.errors()).extracting(FieldError::toString).containsExactly("currency: Expected 'SAR'");
    }
}
