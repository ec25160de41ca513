package com.luanvv.parker.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.luanvv.parker.model.CandidateRecord;
import com.luanvv.parker.model.Submission;
import com.luanvv.parker.model.TimelineEntry;
import org.junit.jupiter.api.Test;

class PageDataExtractorTest {
    private final PageDataExtractor extractor = new PageDataExtractor();

    @Test
    void minimalPageHasOnlyNameAndEmptyTimeline() {
        CandidateRecord candidate = extractor.parse("<h1>Jane Doe</h1>", "https://crm.test/candidates/42");

        assertThat(candidate.id()).isEqualTo("42");
        assertThat(candidate.url()).isEqualTo("https://crm.test/candidates/42");
        assertThat(candidate.name()).isEqualTo("Jane Doe");
        assertThat(candidate.currentOwner()).isEmpty();
        assertThat(candidate.sourcedBy()).isEmpty();
        assertThat(candidate.location()).isEmpty();
        assertThat(candidate.linkedinUrl()).isEmpty();
        assertThat(candidate.submissions()).isEmpty();
        assertThat(candidate.timeline()).hasSize(6)
            .allSatisfy(entry -> assertThat(entry.date()).isEqualTo("N/A"));
        assertThat(candidate.timeline()).extracting(TimelineEntry::label).containsExactlyElementsOf(CandidateRecord.MILESTONES);
    }

    @Test
    void parsesFullDetailPage() {
        CandidateRecord candidate = extractor.parse(Pages.CANDIDATE_42, "https://crm.test/candidates/42");

        assertThat(candidate.name()).isEqualTo("Jane Doe");
        assertThat(candidate.currentOwner()).contains("Alex Morgan");
        assertThat(candidate.sourcedBy()).contains("Sam Lee");
        assertThat(candidate.location()).contains("Austin, TX");
        assertThat(candidate.linkedinUrl()).contains("https://www.linkedin.com/in/jane-doe-12345/");
    }

    @Test
    void timelineFollowsMilestoneOrderNotDocumentOrder() {
        CandidateRecord candidate = extractor.parse(Pages.CANDIDATE_42, "https://crm.test/candidates/42");

        assertThat(candidate.timeline()).containsExactly(
            new TimelineEntry("Sourced", "01/05/24"),
            new TimelineEntry("First Engaged", "1/9/2024"),
            new TimelineEntry("Handed Off", "N/A"),
            new TimelineEntry("First screened", "N/A"),
            new TimelineEntry("First Submitted", "N/A"),
            new TimelineEntry("Most Recently Submitted", "03/01/2024"));
    }

    @Test
    void milestoneDateFoundAfterEarlierLabelWithoutDate() {
        String html = "<h1>Jane Doe</h1><dl><dt>Sourced By</dt><dd>Sam Lee</dd></dl>"
            + "<p>" + "notes ".repeat(70) + "</p>"
            + "<ul><li>Sourced <span>01/05/24</span></li></ul>";

        CandidateRecord candidate = extractor.parse(html, "https://crm.test/candidates/42");

        assertThat(candidate.sourcedBy()).contains("Sam Lee");
        assertThat(candidate.timeline().get(0)).isEqualTo(new TimelineEntry("Sourced", "01/05/24"));
    }

    @Test
    void timelineSurvivesNamesThatChangeLengthWhenLowerCased() {
        String html = "<h1>İİİİİİİİİİ Yılmaz</h1><ul><li>SOURCED 2/3/2024</li><li>First Engaged</li></ul>";

        CandidateRecord candidate = extractor.parse(html, "https://crm.test/candidates/9");

        assertThat(candidate.name()).isEqualTo("İİİİİİİİİİ Yılmaz");
        assertThat(candidate.timeline().get(0)).isEqualTo(new TimelineEntry("Sourced", "2/3/2024"));
        assertThat(candidate.timeline().get(1)).isEqualTo(new TimelineEntry("First Engaged", "N/A"));
    }

    @Test
    void keepsOnlySubmissionRowsWithFiveCells() {
        CandidateRecord candidate = extractor.parse(Pages.CANDIDATE_42, "https://crm.test/candidates/42");

        assertThat(candidate.submissions()).containsExactly(
            new Submission("Staff Engineer", "Acme", "Onsite", "02/01/24", "Alex Morgan"),
            new Submission("Backend Lead", "Globex", "Offer", "03/01/24", "Sam Lee"));
    }

    @Test
    void locationNotAvailableIsAbsent() {
        CandidateRecord candidate = extractor.parse(Pages.CANDIDATE_77, "https://crm.test/candidates/77");

        assertThat(candidate.location()).isEmpty();
        assertThat(candidate.linkedinUrl()).contains("https://www.linkedin.com/in/kaidi-cao-398131117");
    }

    @Test
    void missingHeadingGivesEmptyName() {
        CandidateRecord candidate = extractor.parse("<p>oops</p>", "https://crm.test/candidates/5");

        assertThat(candidate.name()).isEmpty();
        assertThat(candidate.timeline()).hasSize(6);
    }

    @Test
    void urlWithoutIdIsAParseError() {
        assertThatThrownBy(() -> extractor.parse("<h1>Jane</h1>", "https://crm.test/candidates/new"))
            .isInstanceOf(RecordParseException.class);
    }
}
