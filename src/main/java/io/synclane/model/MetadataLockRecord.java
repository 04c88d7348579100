package io.synclane.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MetadataLockRecord(String ownerId, long timestamp, long pid) {
}
