package com.luanvv.parker.core;

import com.microsoft.playwright.APIRequest;
import com.microsoft.playwright.APIRequestContext;
import com.microsoft.playwright.APIResponse;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.FormData;
import com.microsoft.playwright.options.RequestOptions;
import java.util.Map;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class CrmSession implements CrmHttpClient, AutoCloseable {
    private final Config config;
    private final RateLimiter limiter;
    private final Retryer retryer;
    private Playwright playwright;
    private APIRequestContext context;

    public CrmSession(Config config) {
        this(config, new RateLimiter(config.getRateLimit()), new Retryer(config.getRetries()));
    }

    public void start() {
        playwright = Playwright.create();
        APIRequest.NewContextOptions options = new APIRequest.NewContextOptions()
            .setTimeout((double) config.getLogin().getTimeoutMs());
        if (config.getUserAgent() != null && !config.getUserAgent().isBlank()) {
            options.setUserAgent(config.getUserAgent());
        }
        context = playwright.request().newContext(options);
        log.debug("Opened CRM session for {}", config.getBaseUrl());
    }

    @Override
    public CrmResponse get(String path, Map<String, String> query) {
        String url = resolve(path);
        return retryer.runWithRetry("GET " + path, () -> send("GET", url, ctx -> {
            RequestOptions options = RequestOptions.create();
            query.forEach(options::setQueryParam);
            return ctx.get(url, options);
        }));
    }

    @Override
    public CrmResponse postForm(String path, Map<String, String> form) {
        String url = resolve(path);
        FormData data = FormData.create();
        form.forEach(data::set);
        return send("POST", url, ctx -> ctx.post(url, RequestOptions.create().setForm(data)));
    }

    private CrmResponse send(String method, String url, Function<APIRequestContext, APIResponse> call) {
        if (context == null) {
            throw new IllegalStateException("CRM session not started");
        }
        limiter.acquire();
        APIResponse response = null;
        try {
            response = call.apply(context);
            CrmResponse result = new CrmResponse(response.status(), response.url(), response.text());
            log.debug("{} {} -> {} {}", method, url, result.status(), result.url());
            return result;
        } catch (PlaywrightException e) {
            throw new CrmNetworkException(method + " " + url + " failed: " + e.getMessage(), e);
        } finally {
            if (response != null) {
                response.dispose();
            }
        }
    }

    private String resolve(String path) {
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        return config.urlFor(path);
    }

    @Override
    public void close() {
        if (context != null) context.dispose();
        if (playwright != null) playwright.close();
    }
}
