package com.luanvv.parker.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CandidateRecordTest {

    @Test
    void defaultsToSixMissingMilestones() {
        CandidateRecord candidate = CandidateRecord.builder().id("1").url("/candidates/1").build();

        assertThat(candidate.timeline()).hasSize(6).noneMatch(TimelineEntry::isPresent);
        assertThat(candidate.linkedinUrl()).isEmpty();
        assertThat(candidate.submissions()).isEmpty();
    }

    @Test
    void rejectsTimelineOfWrongLength() {
        assertThatThrownBy(() -> CandidateRecord.builder()
            .id("1")
            .timeline(List.of(TimelineEntry.missing("Sourced")))
            .build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void linkedinFallbackOnlyFillsAbsentValue() {
        CandidateRecord bare = CandidateRecord.builder().id("1").build();
        CandidateRecord withUrl = bare.toBuilder().linkedinUrl(Optional.of("https://linkedin.com/in/a")).build();

        assertThat(bare.withLinkedinUrlIfAbsent("https://linkedin.com/in/b").linkedinUrl()).contains("https://linkedin.com/in/b");
        assertThat(withUrl.withLinkedinUrlIfAbsent("https://linkedin.com/in/b").linkedinUrl()).contains("https://linkedin.com/in/a");
    }

    @Test
    void profileHintsAreTrimmedAndBlankDropped() {
        ProfileRef ref = ProfileRef.of("https://linkedin.com/in/a", "  Ann ", "   ");

        assertThat(ref.firstNameHint()).contains("Ann");
        assertThat(ref.lastNameHint()).isEmpty();
        assertThat(ref.hasNameHints()).isTrue();
        assertThat(ProfileRef.of("https://linkedin.com/in/a").hasNameHints()).isFalse();
    }
}
