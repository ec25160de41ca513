package com.luanvv.parker.core;

import java.util.Optional;
import java.util.regex.Matcher;

public record CrmResponse(int status, String url, String body) {

    public CrmResponse {
        body = body == null ? "" : body;
    }

    public boolean ok() {
        return status >= 200 && status < 300;
    }

    /** Path component of the final URL, without query or fragment. */
    public String path() {
        return ProfileUrls.pathOf(url);
    }

    public boolean landedOn(String expectedPath) {
        return trimSlash(path()).equals(trimSlash(expectedPath));
    }

    public boolean isDetailPage() {
        return detailId().isPresent();
    }

    /** Candidate id when the final URL is exactly a detail page. */
    public Optional<String> detailId() {
        Matcher m = CrmPaths.DETAIL_PATH.matcher(path());
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static String trimSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
