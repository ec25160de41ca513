package com.luanvv.parker.core;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ProfileUrls {

    /** An anchor target that points at a LinkedIn profile. */
    public static final Pattern PROFILE_URL = Pattern.compile("linkedin\\.com/in/[^\\s\"'?#]+", Pattern.CASE_INSENSITIVE);

    /** Trailing id LinkedIn appends to a slug: a hyphen and 5+ alphanumerics with at least one digit. */
    private static final Pattern SLUG_ID_SUFFIX = Pattern.compile("-(?=[a-z]*\\d)[a-z0-9]{5,}$", Pattern.CASE_INSENSITIVE);

    private static final Pattern SCHEME_ONLY = Pattern.compile("https?:/*|/+");

    private static final Pattern CANDIDATE_ID = Pattern.compile("/candidates/(\\d+)/?(?:[?#].*)?$");

    private ProfileUrls() {
    }

    /**
     * Canonical form used to compare profile URLs: lower case, https scheme, no {@code www.},
     * no trailing slashes. Idempotent.
     */
    public static String normalize(String url) {
        if (url == null) {
            return "";
        }
        String u = url.trim().toLowerCase(Locale.ROOT);
        // A bare scheme or bare slashes normalize to "https:".
        if (SCHEME_ONLY.matcher(u).matches()) {
            return "https:";
        }
        if (u.startsWith("http://")) {
            u = "https://" + u.substring("http://".length());
        } else if (!u.startsWith("https://") && !u.isEmpty()) {
            u = "https://" + u.replaceFirst("^/+", "");
        }
        u = u.replaceFirst("^https://(www\\.)+", "https://");
        return u.replaceAll("/+$", "");
    }

    public static boolean isProfileUrl(String href) {
        return href != null && PROFILE_URL.matcher(href).find();
    }

    /** Final non-empty path segment of {@code url}, URL-decoded; empty when there is none. */
    public static String slugOf(String url) {
        String path = pathOf(url);
        String[] segments = path.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isBlank()) {
                try {
                    return URLDecoder.decode(segments[i], StandardCharsets.UTF_8);
                } catch (IllegalArgumentException e) {
                    return segments[i];
                }
            }
        }
        return "";
    }

    /**
     * Searchable name tokens from a profile slug: the trailing id suffix is stripped, the rest is
     * split on hyphens and single characters are dropped.
     *
     * <p>{@code "kaidi-cao-398131117"} gives {@code [kaidi, cao]}; a slug without hyphens such as
     * {@code "anshulsaha"} comes back whole as one token. Purely alphabetic suffixes are never
     * stripped, so {@code "john-smith"} keeps both parts.
     */
    public static List<String> tokensFromSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            return List.of();
        }
        String stripped = SLUG_ID_SUFFIX.matcher(slug.trim()).replaceFirst("");
        return Arrays.stream(stripped.split("-"))
            .filter(part -> part.length() > 1)
            .toList();
    }

    public static List<String> tokensFromUrl(String url) {
        return tokensFromSlug(slugOf(url));
    }

    /** Path of {@code url}; tolerates relative references and unparseable input. */
    public static String pathOf(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        try {
            String path = new URI(url.trim()).getRawPath();
            return path == null ? "" : path;
        } catch (URISyntaxException e) {
            String s = url.replaceFirst("^[a-zA-Z]+://[^/]*", "");
            int cut = s.indexOf('?');
            if (cut < 0) cut = s.indexOf('#');
            return cut < 0 ? s : s.substring(0, cut);
        }
    }

    /** Numeric candidate id at the end of a CRM detail URL. */
    public static String candidateIdFrom(String url) {
        Matcher m = CANDIDATE_ID.matcher(url == null ? "" : url);
        if (!m.find()) {
            throw new RecordParseException("No candidate id in URL: " + url);
        }
        return m.group(1);
    }
}
