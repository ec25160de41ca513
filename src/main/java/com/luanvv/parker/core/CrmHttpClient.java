package com.luanvv.parker.core;

import java.util.Map;

public interface CrmHttpClient {

    default CrmResponse get(String path) {
        return get(path, Map.of());
    }

    CrmResponse get(String path, Map<String, String> query);

    /** Sends {@code form} as {@code application/x-www-form-urlencoded}. */
    CrmResponse postForm(String path, Map<String, String> form);
}
