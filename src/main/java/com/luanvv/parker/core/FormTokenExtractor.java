package com.luanvv.parker.core;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.parser.Parser;

@Slf4j
public class FormTokenExtractor {

    private static final List<Pattern> SHAPES = List.of(
        Pattern.compile("<meta\\s[^>]*?content=[\"']([^\"']+)[\"'][^>]*?name=[\"']csrf-token[\"']", Pattern.CASE_INSENSITIVE),
        Pattern.compile("<meta\\s[^>]*?name=[\"']csrf-token[\"'][^>]*?content=[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE),
        Pattern.compile("<input[^>]*?value=[\"']([^\"']+)[\"'][^>]*?name=[\"']authenticity_token[\"']", Pattern.CASE_INSENSITIVE),
        Pattern.compile("<input[^>]*?name=[\"']authenticity_token[\"'][^>]*?value=[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE)
    );

    /** Token from {@code html}, or an empty string when no recognized shape is present. */
    public String extractToken(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        for (Pattern shape : SHAPES) {
            Matcher m = shape.matcher(html);
            if (m.find()) {
                return decodeEntities(m.group(1));
            }
        }
        return "";
    }

    /**
     * Like {@link #extractToken(String)} but fails when there is no token.
     *
     * @param page human-readable page name for the error message
     */
    public String requireToken(String html, String page) {
        String token = extractToken(html);
        if (token.isEmpty()) {
            log.warn("No CSRF token found on {}", page);
            throw new TokenExtractionException(page);
        }
        return token;
    }

    static String decodeEntities(String value) {
        return Parser.unescapeEntities(value, true);
    }
}
