package io.statuswire.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status record as published in a commit. Timestamps stay raw; the ingestor parses them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatusRecordBody(
        @JsonProperty("$type") String type,
        @JsonProperty("emoji") String emoji,
        @JsonProperty("text") String text,
        @JsonProperty("createdAt") String createdAt,
        @JsonProperty("expires") String expires) {
}
