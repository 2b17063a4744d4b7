package io.practicedb.core.sync;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Wire shape shared by pushed entries and pulled changes. {@code data} is null for deletions and
 * for documents that no longer exist locally.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncChange(SyncAction action, String documentId, Map<String, Object> data, String timestamp) {
}
