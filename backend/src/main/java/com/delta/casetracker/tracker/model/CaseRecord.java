package com.delta.casetracker.tracker.model;

import com.delta.casetracker.tracker.util.HashUtils;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * One tracked case as observed in the registry.
 *
 * <p>{@code documentCount}, {@code lastMovementAt} and {@code tags} are the mutable fields; the
 * fingerprint is derived from them and nothing else, so a retitled case is not an update.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaseRecord(
    String id,
    CaseCategory category,
    String title,
    List<String> tags,
    int documentCount,
    Instant lastMovementAt
) {
    public CaseRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Case record id must not be blank");
        }
        id = id.trim();
        tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).toList();
        documentCount = Math.max(0, documentCount);
    }

    /**
     * Tags with blanks removed, trimmed, de-duplicated and sorted.
     */
    public List<String> normalizedTags() {
        TreeSet<String> out = new TreeSet<>();
        for (String tag : tags) {
            if (!tag.isBlank()) {
                out.add(tag.trim());
            }
        }
        return new ArrayList<>(out);
    }

    public String fingerprint() {
        List<String> fields = new ArrayList<>();
        fields.add(Integer.toString(documentCount));
        fields.add(lastMovementAt == null ? null : lastMovementAt.toString());
        fields.add(String.join("\u001e", normalizedTags()));
        return HashUtils.sha256HexOfFields(fields);
    }
}
