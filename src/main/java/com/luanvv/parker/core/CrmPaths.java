package com.luanvv.parker.core;

import java.util.regex.Pattern;

public final class CrmPaths {
    public static final String ROOT = "/";
    public static final String SIGN_IN = "/users/sign_in";
    public static final String LINKEDIN_URL_CHECK = "/candidates/linkedin_url_check";
    public static final String CHECK_LINKEDIN_URL = "/candidates/check_linkedin_url";
    public static final String CANDIDATES = "/candidates";
    public static final String NEW_CANDIDATE = "/candidates/new";

    public static final String SEARCH_PARAM = "q[first_name_or_last_name_cont]";
    public static final String TOKEN_FIELD = "authenticity_token";

    /** Path of a candidate detail page, e.g. {@code /candidates/42}. */
    public static final Pattern DETAIL_PATH = Pattern.compile("^/candidates/(\\d+)/?$");

    private CrmPaths() {
    }

    public static String detail(String id) {
        return CANDIDATES + "/" + id;
    }
}
