package io.practicedb.core.schema;

import static io.practicedb.core.schema.FieldSpec.any;
import static io.practicedb.core.schema.FieldSpec.arrayOf;
import static io.practicedb.core.schema.FieldSpec.bool;
import static io.practicedb.core.schema.FieldSpec.enumOf;
import static io.practicedb.core.schema.FieldSpec.literal;
import static io.practicedb.core.schema.FieldSpec.number;
import static io.practicedb.core.schema.FieldSpec.object;
import static io.practicedb.core.schema.FieldSpec.recordOf;
import static io.practicedb.core.schema.FieldSpec.string;

import io.practicedb.core.Documents;
import io.practicedb.core.PracticeCollections;

/**
 * Default document shapes for the practice collections. {@code id} and the engine timestamps are
 * optional everywhere since the engine assigns them.
 */
public final class PracticeSchemas {

    public static final Schema PATIENT = document()
            .field("mrn", string())
            .field("name", string().minLength(2))
            .field("nameAr", string().optional())
            .field("age", number().min(0).max(150))
            .field("dateOfBirth", string())
            .field("gender", enumOf("male", "female"))
            .field("nationalId", string().optional())
            .field("phone", string())
            .field("email", string().email().optional())
            .field("address", string())
            .field("emergencyContact", object(Schema.builder()
                    .field("name", string())
                    .field("phone", string())
                    .field("relationship", string())
                    .build()))
            .field("bloodType", enumOf("A+", "A-", "B+", "B-", "AB+", "AB-", "O+", "O-"))
            .field("allergies", arrayOf(string()))
            .field("conditions", arrayOf(string()))
            .field("medications", arrayOf(object(Schema.builder()
                    .field("name", string())
                    .field("dosage", string())
                    .field("frequency", string())
                    .field("startDate", string())
                    .field("endDate", string().optional())
                    .field("prescribedBy", string())
                    .build())))
            .field("insuranceInfo", object(Schema.builder()
                    .field("provider", string())
                    .field("policyNumber", string())
                    .field("groupNumber", string().optional())
                    .field("validFrom", string())
                    .field("validTo", string())
                    .field("coverageType", enumOf("basic", "comprehensive", "premium"))
                    .field("nphiesId", string().optional())
                    .build()).optional())
            .field("lastVisit", string())
            .field("status", enumOf("stable", "critical", "improving", "monitoring", "discharged"))
            .build();

    public static final Schema APPOINTMENT = document()
            .field("patientId", string())
            .field("patientName", string())
            .field("doctorId", string())
            .field("doctorName", string())
            .field("date", string())
            .field("time", string())
            .field("endTime", string())
            .field("type", enumOf("consultation", "follow-up", "telemedicine", "emergency", "procedure",
                    "lab-visit", "imaging"))
            .field("status", enumOf("scheduled", "confirmed", "checked-in", "in-progress", "completed",
                    "cancelled", "no-show", "rescheduled"))
            .field("duration", number())
            .field("notes", string().optional())
            .field("chiefComplaint", string().optional())
            .field("location", string().optional())
            .field("isRecurring", bool().optional())
            .field("recurringPattern", object(Schema.builder()
                    .field("frequency", enumOf("daily", "weekly", "biweekly", "monthly"))
                    .field("interval", number())
                    .field("endDate", string().optional())
                    .field("occurrences", number().optional())
                    .build()).optional())
            .field("reminders", arrayOf(object(Schema.builder()
                    .field("type", enumOf("sms", "email", "push"))
                    .field("scheduledFor", string())
                    .field("sent", bool())
                    .field("sentAt", string().optional())
                    .build())))
            .field("externalId", string().optional())
            .field("externalSystem", string().optional())
            .field("syncStatus", enumOf("pending", "synced", "error").optional())
            .build();

    public static final Schema CLAIM = document()
            .field("claimNumber", string())
            .field("patientId", string())
            .field("patientName", string())
            .field("patientNationalId", string().optional())
            .field("insuranceId", string())
            .field("providerId", string())
            .field("serviceDate", string())
            .field("submittedDate", string())
            .field("amount", number())
            .field("currency", literal("SAR"))
            .field("status", enumOf("draft", "pending", "submitted", "processing", "approved", "partially-approved",
                    "rejected", "cancelled", "appealed"))
            .field("type", enumOf("institutional", "professional", "oral", "vision", "pharmacy"))
            .field("priority", enumOf("normal", "urgent", "emergency"))
            .field("services", arrayOf(object(Schema.builder()
                    .field("sequence", number())
                    .field("serviceCode", string())
                    .field("serviceName", string())
                    .field("quantity", number())
                    .field("unitPrice", number())
                    .field("totalPrice", number())
                    .field("serviceDate", string())
                    .field("diagnosisReference", arrayOf(number()).optional())
                    .build())))
            .field("diagnosis", arrayOf(object(Schema.builder()
                    .field("sequence", number())
                    .field("code", string())
                    .field("system", enumOf("ICD-10", "ICD-11"))
                    .field("description", string())
                    .field("type", enumOf("principal", "secondary", "admitting"))
                    .build())))
            .field("responseCode", string().optional())
            .field("responseMessage", string().optional())
            .field("approvedAmount", number().optional())
            .field("rejectionReason", string().optional())
            .field("createdBy", string())
            .field("processedAt", string().optional())
            .build();

    public static final Schema PRE_AUTHORIZATION = document()
            .field("patientId", string())
            .field("insuranceId", string())
            .field("requestedDate", string())
            .field("status", enumOf("draft", "pending", "approved", "rejected", "cancelled", "expired"))
            .field("services", arrayOf(object(Schema.builder()
                    .field("serviceCode", string())
                    .field("serviceName", string())
                    .field("quantity", number().min(1))
                    .build())))
            .field("approvedUntil", string().optional())
            .field("responseMessage", string().optional())
            .build();

    public static final Schema MEDICAL_RECORD = document()
            .field("patientId", string())
            .field("date", string())
            .field("type", enumOf("consultation", "procedure", "lab", "imaging", "prescription"))
            .field("diagnosis", string())
            .field("treatment", string())
            .field("notes", string())
            .field("vitals", object(Schema.builder()
                    .field("bloodPressure", string())
                    .field("heartRate", number())
                    .field("temperature", number())
                    .field("respiratoryRate", number().optional())
                    .field("oxygenSaturation", number().optional())
                    .field("weight", number())
                    .field("height", number())
                    .field("bmi", number())
                    .field("recordedAt", string())
                    .build()).optional())
            .field("doctorId", string())
            .field("doctorName", string())
            .field("attachments", arrayOf(object(Schema.builder()
                    .field("id", string())
                    .field("name", string())
                    .field("type", string())
                    .field("size", number())
                    .field("url", string())
                    .field("uploadedAt", string())
                    .field("uploadedBy", string())
                    .build())).optional())
            .build();

    public static final Schema LAB_RESULT = document()
            .field("patientId", string())
            .field("testName", string())
            .field("testCode", string().optional())
            .field("result", string())
            .field("unit", string().optional())
            .field("normalRange", string())
            .field("status", enumOf("normal", "abnormal", "critical"))
            .field("date", string())
            .field("performedBy", string().optional())
            .field("notes", string().optional())
            .build();

    public static final Schema NOTIFICATION = document()
            .field("userId", string())
            .field("type", enumOf("appointment-reminder", "appointment-cancelled", "lab-results", "claim-status",
                    "consultation-request", "system-alert", "urgent-patient"))
            .field("title", string())
            .field("message", string())
            .field("data", recordOf(any()).optional())
            .field("isRead", bool())
            .field("priority", enumOf("low", "normal", "high", "urgent"))
            .field("readAt", string().optional())
            .field("expiresAt", string().optional())
            .build();

    public static final Schema USER = document()
            .field("githubId", string())
            .field("email", string().email())
            .field("name", string())
            .field("avatar", string().optional())
            .field("role", enumOf("doctor", "nurse", "admin", "receptionist"))
            .field("specialization", string().optional())
            .field("licenseNumber", string().optional())
            .field("department", string().optional())
            .field("isActive", bool())
            .field("lastLogin", string().optional())
            .field("preferences", object(Schema.builder()
                    .field("theme", enumOf("light", "dark", "system"))
                    .field("language", enumOf("en", "ar"))
                    .field("notifications", object(Schema.builder()
                            .field("email", bool())
                            .field("sms", bool())
                            .field("push", bool())
                            .build()))
                    .field("defaultView", enumOf("dashboard", "appointments", "patients"))
                    .build()))
            .build();

    public static final Schema MESSAGE = document()
            .field("conversationId", string())
            .field("senderId", string())
            .field("senderName", string())
            .field("content", string())
            .field("type", enumOf("text", "file", "consultation-request", "referral"))
            .field("attachments", arrayOf(object(Schema.builder()
                    .field("id", string())
                    .field("name", string())
                    .field("type", string())
                    .field("url", string())
                    .build())).optional())
            .field("isRead", bool())
            .build();

    public static final Schema CONVERSATION = document()
            .field("participants", arrayOf(object(Schema.builder()
                    .field("id", string())
                    .field("name", string())
                    .field("avatar", string().optional())
                    .field("role", string())
                    .build())))
            .field("lastMessage", string().optional())
            .field("lastMessageAt", string().optional())
            .field("unreadCount", number())
            .field("type", enumOf("direct", "group", "consultation"))
            .build();

    public static final Schema TELEMEDICINE_SESSION = document()
            .field("appointmentId", string().optional())
            .field("patientId", string())
            .field("patientName", string())
            .field("doctorId", string())
            .field("doctorName", string())
            .field("scheduledTime", string())
            .field("startedAt", string().optional())
            .field("endedAt", string().optional())
            .field("duration", number().optional())
            .field("status", enumOf("scheduled", "waiting", "active", "completed", "missed", "cancelled",
                    "technical-issue"))
            .field("type", enumOf("video", "audio", "chat"))
            .field("roomUrl", string().optional())
            .field("recordingUrl", string().optional())
            .field("isRecorded", bool())
            .field("notes", string().optional())
            .field("prescription", string().optional())
            .field("followUpRequired", bool().optional())
            .field("technicalIssues", arrayOf(string()).optional())
            .build();

    private PracticeSchemas() {
    }

    public static void registerAll(SchemaRegistry registry) {
        registry.register(PracticeCollections.PATIENTS, PATIENT)
                .register(PracticeCollections.APPOINTMENTS, APPOINTMENT)
                .register(PracticeCollections.CLAIMS, CLAIM)
                .register(PracticeCollections.PRE_AUTHORIZATIONS, PRE_AUTHORIZATION)
                .register(PracticeCollections.MEDICAL_RECORDS, MEDICAL_RECORD)
                .register(PracticeCollections.LAB_RESULTS, LAB_RESULT)
                .register(PracticeCollections.NOTIFICATIONS, NOTIFICATION)
                .register(PracticeCollections.USERS, USER)
                .register(PracticeCollections.MESSAGES, MESSAGE)
                .register(PracticeCollections.CONVERSATIONS, CONVERSATION)
                .register(PracticeCollections.TELEMEDICINE_SESSIONS, TELEMEDICINE_SESSION);
    }

    private static Schema.Builder document() {
        return Schema.builder()
                .field(Documents.ID, string().optional())
                .field(Documents.CREATED_AT, string().optional())
                .field(Documents.UPDATED_AT, string().optional());
    }
}
