package triage.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Classification parsing")
class SubjectClassTest {

    @Test
    @DisplayName("should accept wire values and constant names in any case")
    void shouldParseLeniently() {
        assertEquals(Optional.of(SubjectClass.DOCTOR), SubjectClass.fromValue("doctor"));
        assertEquals(Optional.of(SubjectClass.DOCTOR), SubjectClass.fromValue(" DOCTOR "));
        assertEquals(Optional.of(OperationType.PATIENT_ACCESS), OperationType.fromValue("patient_access"));
        assertEquals(Optional.of(OperationType.BULK_OPERATION), OperationType.fromValue("Bulk_Operation"));
    }

    @Test
    @DisplayName("should return empty for unknown or blank values")
    void shouldReturnEmptyForUnknown() {
        assertTrue(SubjectClass.fromValue("janitor").isEmpty());
        assertTrue(SubjectClass.fromValue("").isEmpty());
        assertTrue(SubjectClass.fromValue(null).isEmpty());
        assertTrue(OperationType.fromValue("teleport").isEmpty());
    }

    @Test
    @DisplayName("wire value should be the lower-case name")
    void wireValueShouldBeLowerCase() {
        assertEquals("receptionist", SubjectClass.RECEPTIONIST.value());
        assertEquals("document_upload", OperationType.DOCUMENT_UPLOAD.value());
    }
}
