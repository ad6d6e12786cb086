package com.hltvsync.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Typed records and entity references extracted from one page.
 * References drive child planning and are never persisted.
 */
public record Extraction(
        PageKind pageKind,
        Long subjectId,
        String url,
        Instant fetchedAt,
        List<ExtractedRecord> records,
        List<EntityRef> references) {

    public Extraction {
        records = records == null ? List.of() : List.copyOf(records);
        references = references == null ? List.of() : List.copyOf(references);
    }

    public List<EntityRef> referencesOf(EntityKind kind) {
        return references.stream().filter(ref -> ref.kind() == kind).toList();
    }
}
