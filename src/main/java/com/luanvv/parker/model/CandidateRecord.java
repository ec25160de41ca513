package com.luanvv.parker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Optional;
import lombok.Builder;

/**
 * A candidate as parsed from its CRM detail page.
 *
 * <p>{@code id} is the numeric suffix of {@code url}. {@code timeline} always holds the six
 * milestones in {@link #MILESTONES} order. Fields the page does not show are empty, and are left
 * out when the record is written as JSON.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record CandidateRecord(
    String id,
    String url,
    String name,
    Optional<String> currentOwner,
    Optional<String> sourcedBy,
    Optional<String> location,
    Optional<String> linkedinUrl,
    List<TimelineEntry> timeline,
    List<Submission> submissions
) {
    public static final List<String> MILESTONES = List.of(
        "Sourced",
        "First Engaged",
        "Handed Off",
        "First screened",
        "First Submitted",
        "Most Recently Submitted"
    );

    public CandidateRecord {
        name = name == null ? "" : name;
        currentOwner = currentOwner == null ? Optional.empty() : currentOwner;
        sourcedBy = sourcedBy == null ? Optional.empty() : sourcedBy;
        location = location == null ? Optional.empty() : location;
        linkedinUrl = linkedinUrl == null ? Optional.empty() : linkedinUrl;
        timeline = timeline == null
            ? MILESTONES.stream().map(TimelineEntry::missing).toList()
            : List.copyOf(timeline);
        if (timeline.size() != MILESTONES.size()) {
            throw new IllegalArgumentException("Timeline must have " + MILESTONES.size() + " entries, got " + timeline.size());
        }
        submissions = submissions == null ? List.of() : List.copyOf(submissions);
    }

    /** Returns this record with {@code fallback} as its LinkedIn URL when the page showed none. */
    public CandidateRecord withLinkedinUrlIfAbsent(String fallback) {
        if (linkedinUrl.isPresent() || fallback == null || fallback.isBlank()) {
            return this;
        }
        return toBuilder().linkedinUrl(Optional.of(fallback)).build();
    }
}
