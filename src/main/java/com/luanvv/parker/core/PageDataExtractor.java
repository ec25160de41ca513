package com.luanvv.parker.core;

import com.luanvv.parker.model.CandidateRecord;
import com.luanvv.parker.model.Submission;
import com.luanvv.parker.model.TimelineEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

@Slf4j
public class PageDataExtractor {
    static final int TIMELINE_WINDOW = 300;
    static final int SUBMISSION_CELLS = 5;

    private static final String DATE = "\\d{1,2}/\\d{1,2}/\\d{2,4}";

    public CandidateRecord parse(String html, String finalUrl) {
        String id = ProfileUrls.candidateIdFrom(finalUrl);
        Document doc = Jsoup.parse(html == null ? "" : html, finalUrl);

        CandidateRecord candidate = CandidateRecord.builder()
            .id(id)
            .url(finalUrl)
            .name(extractName(doc))
            .sourcedBy(labelledValue(doc, "Sourced By"))
            .currentOwner(labelledValue(doc, "Current Owner"))
            .location(labelledValue(doc, "Location").filter(loc -> !TimelineEntry.NOT_AVAILABLE.equals(loc)))
            .linkedinUrl(extractLinkedinUrl(doc))
            .timeline(extractTimeline(doc))
            .submissions(extractSubmissions(doc))
            .build();
        log.debug("Parsed candidate {} ({}) with {} submissions", candidate.id(), candidate.name(), candidate.submissions().size());
        return candidate;
    }

    String extractName(Document doc) {
        Element h1 = doc.selectFirst("h1");
        return h1 == null ? "" : h1.text().trim();
    }

    /** Value of the {@code dd} right after the {@code dt} whose text is {@code label}. */
    Optional<String> labelledValue(Document doc, String label) {
        String wanted = squash(label);
        for (Element dt : doc.select("dt")) {
            if (!squash(dt.text()).equals(wanted)) {
                continue;
            }
            Element value = dt.nextElementSibling();
            if (value == null || !"dd".equals(value.normalName())) {
                continue;
            }
            String text = value.text().trim();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }
        return Optional.empty();
    }

    List<TimelineEntry> extractTimeline(Document doc) {
        String text = doc.body() == null ? doc.text() : doc.body().text();
        List<TimelineEntry> timeline = new ArrayList<>(CandidateRecord.MILESTONES.size());
        for (String label : CandidateRecord.MILESTONES) {
            timeline.add(new TimelineEntry(label, dateAfter(text, label).orElse(TimelineEntry.NOT_AVAILABLE)));
        }
        return timeline;
    }

    // Every occurrence of the label is tried, so an earlier "Sourced By" field does not hide the milestone.
    private Optional<String> dateAfter(String text, String label) {
        Matcher m = milestonePattern(label).matcher(text);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static Pattern milestonePattern(String label) {
        return Pattern.compile(Pattern.quote(label) + "[\\s\\S]{0," + TIMELINE_WINDOW + "}?(" + DATE + ")",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    Optional<String> extractLinkedinUrl(Document doc) {
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            if (ProfileUrls.isProfileUrl(href)) {
                return Optional.of(href);
            }
        }
        return Optional.empty();
    }

    List<Submission> extractSubmissions(Document doc) {
        Element table = doc.selectFirst("table");
        if (table == null) {
            return List.of();
        }
        Elements rows = table.select("tr");
        List<Submission> submissions = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            List<Element> cells = rows.get(i).children().stream()
                .filter(cell -> "td".equals(cell.normalName()))
                .toList();
            if (cells.size() < SUBMISSION_CELLS) {
                log.debug("Skipping submissions row {} with {} cells", i, cells.size());
                continue;
            }
            submissions.add(new Submission(
                cells.get(0).text().trim(),
                cells.get(1).text().trim(),
                cells.get(2).text().trim(),
                cells.get(3).text().trim(),
                cells.get(4).text().trim()));
        }
        return submissions;
    }

    private static String squash(String s) {
        return s.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }
}
