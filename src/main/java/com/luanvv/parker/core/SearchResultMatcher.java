package com.luanvv.parker.core;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

@Slf4j
public class SearchResultMatcher {

    private static final Pattern DETAIL_HREF = Pattern.compile("^(?:https?://[^/]+)?(/candidates/\\d+)/?$", Pattern.CASE_INSENSITIVE);

    /** Detail-page path such as {@code /candidates/42}, or empty when no row matches. */
    public Optional<String> findCandidatePath(String listingHtml, String targetProfileUrl) {
        String target = ProfileUrls.normalize(targetProfileUrl);
        Document doc = Jsoup.parse(listingHtml == null ? "" : listingHtml);
        Element table = doc.selectFirst("table");
        if (table == null) {
            log.debug("No results table in listing");
            return Optional.empty();
        }

        Elements rows = table.select("tr");
        for (int i = 1; i < rows.size(); i++) {
            Element row = rows.get(i);
            Optional<String> profile = firstProfileHref(row);
            if (profile.isEmpty() || !ProfileUrls.normalize(profile.get()).equals(target)) {
                continue;
            }
            Optional<String> detail = detailPath(row);
            if (detail.isPresent()) {
                log.debug("Matched {} in results row {}", target, i);
                return detail;
            }
            log.debug("Row {} matches {} but has no candidate link", i, target);
        }
        return Optional.empty();
    }

    private Optional<String> firstProfileHref(Element row) {
        for (Element a : row.select("a[href]")) {
            if (ProfileUrls.isProfileUrl(a.attr("href"))) {
                return Optional.of(a.attr("href"));
            }
        }
        return Optional.empty();
    }

    private Optional<String> detailPath(Element row) {
        for (Element a : row.select("a[href]")) {
            Matcher m = DETAIL_HREF.matcher(a.attr("href").trim());
            if (m.matches()) {
                return Optional.of(m.group(1));
            }
        }
        return Optional.empty();
    }
}
