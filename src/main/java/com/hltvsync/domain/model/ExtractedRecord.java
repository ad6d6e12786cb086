package com.hltvsync.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;
import java.util.Set;

/**
 * A typed record extracted from one page.
 *
 * A field that is null and not listed in {@link #emptyFields()} was not present in the source.
 * A listed field was present and intentionally empty.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EventRecord.class, name = "event"),
    @JsonSubTypes.Type(value = TeamRecord.class, name = "team"),
    @JsonSubTypes.Type(value = PlayerRecord.class, name = "player"),
    @JsonSubTypes.Type(value = EventStatRecord.class, name = "eventStat"),
    @JsonSubTypes.Type(value = AssociationRecord.class, name = "association")
})
public interface ExtractedRecord {

    Set<String> emptyFields();

    /**
     * Key fields identifying the stored row.
     */
    Map<String, Object> key();

    /**
     * Non-key fields to merge into the stored row.
     */
    Map<String, Object> fields();
}
