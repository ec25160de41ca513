package com.luanvv.parker.core;

import com.luanvv.parker.model.CandidateRecord;
import com.luanvv.parker.model.CreateResult;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

@Slf4j
@RequiredArgsConstructor
public class CandidateCreator {
    static final String OWNER_FIELD = "candidate[candidate_owner_id]";
    static final String SOURCED_BY_FIELD = "candidate[sourced_by_id]";

    private final Config config;
    private final CrmHttpClient http;
    private final SessionAuthenticator authenticator;
    private final CredentialStore credentials;
    private final FormTokenExtractor tokens;
    private final PageDataExtractor pages;
    private final Clock clock;

    public CandidateCreator(Config config, CrmHttpClient http, SessionAuthenticator authenticator,
                            CredentialStore credentials, FormTokenExtractor tokens, PageDataExtractor pages) {
        this(config, http, authenticator, credentials, tokens, pages, Clock.systemDefaultZone());
    }

    /**
     * @param sourcedDate date the candidate was sourced; today when {@code null}
     */
    public CreateResult create(String firstName, String lastName, String url, LocalDate sourcedDate) {
        Optional<String> invalid = validate(firstName, lastName, url);
        if (invalid.isPresent()) {
            return new CreateResult.ValidationError(invalid.get());
        }
        try {
            if (!authenticator.ensureSession()) {
                return new CreateResult.AuthError("Not authenticated with the CRM.");
            }
            return submit(firstName.trim(), lastName.trim(), url.trim(), sourcedDate);
        } catch (TokenExtractionException | CrmNetworkException e) {
            log.warn("Create failed for {}: {}", url, e.getMessage());
            return new CreateResult.NetworkError(e.getMessage());
        } catch (Exception e) {
            log.error("Create failed for {}", url, e);
            return new CreateResult.NetworkError(e.getMessage() != null ? e.getMessage() : "Failed to create candidate.");
        }
    }

    private CreateResult submit(String firstName, String lastName, String url, LocalDate sourcedDate) {
        CrmResponse checkPage = http.get(CrmPaths.LINKEDIN_URL_CHECK);
        Map<String, String> check = new LinkedHashMap<>();
        check.put(CrmPaths.TOKEN_FIELD, tokens.requireToken(checkPage.body(), "LinkedIn URL check page"));
        check.put("linkedin_url", url);
        CrmResponse checked = http.postForm(CrmPaths.CHECK_LINKEDIN_URL, check);

        if (checked.ok() && checked.isDetailPage()) {
            CandidateRecord existing = pages.parse(checked.body(), checked.url());
            log.info("Candidate {} already exists for {}, nothing created", existing.id(), url);
            return new CreateResult.AlreadyExists(existing.withLinkedinUrlIfAbsent(url));
        }

        CrmResponse form = newCandidateForm(checked);
        String token = tokens.requireToken(form.body(), "new candidate form");
        Optional<String> ownerId = credentials.email().flatMap(email -> findOwnerId(form.body(), email));
        if (ownerId.isEmpty()) {
            if (config.getCreate().isRequireOwner()) {
                return new CreateResult.ValidationError(
                    "No owner option matches " + credentials.email().orElse("the configured email") + ".");
            }
            log.warn("No owner option matches the configured email; creating {} without an owner", url);
        }

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(CrmPaths.TOKEN_FIELD, token);
        payload.put("candidate[first_name]", firstName);
        payload.put("candidate[last_name]", lastName);
        payload.put("candidate[linkedin_url]", url);
        payload.put("candidate[sourced_date]", (sourcedDate != null ? sourcedDate : LocalDate.now(clock)).format(DateTimeFormatter.ISO_LOCAL_DATE));
        payload.put("commit", config.getCreate().getCommitLabel());
        ownerId.ifPresent(id -> {
            payload.put(OWNER_FIELD, id);
            payload.put(SOURCED_BY_FIELD, id);
        });

        CrmResponse created = http.postForm(CrmPaths.CANDIDATES, payload);
        if (created.ok() && created.isDetailPage()) {
            CandidateRecord candidate = parseCreated(created, firstName, lastName);
            log.info("Created candidate {} for {}", candidate.id(), url);
            return new CreateResult.Created(candidate.withLinkedinUrlIfAbsent(url));
        }

        String reason = errorMessage(created.body()).orElse("HTTP " + created.status());
        log.warn("CRM rejected candidate {}: {}", url, reason);
        return new CreateResult.ValidationError("CRM rejected the candidate: " + reason);
    }

    // The record exists once the CRM redirects to it; an unreadable page must not turn that into a failure.
    private CandidateRecord parseCreated(CrmResponse created, String firstName, String lastName) {
        try {
            return pages.parse(created.body(), created.url());
        } catch (RuntimeException e) {
            log.warn("Created candidate page {} could not be parsed: {}", created.url(), e.toString());
            return CandidateRecord.builder()
                .id(ProfileUrls.candidateIdFrom(created.url()))
                .url(created.url())
                .name(firstName + " " + lastName)
                .build();
        }
    }

    /** The create form, reusing the URL-check response when it already redirected there. */
    private CrmResponse newCandidateForm(CrmResponse checked) {
        if (checked.ok() && checked.landedOn(CrmPaths.NEW_CANDIDATE) && !tokens.extractToken(checked.body()).isEmpty()) {
            return checked;
        }
        CrmResponse form = http.get(CrmPaths.NEW_CANDIDATE);
        if (!form.ok()) {
            throw new CrmNetworkException("Could not load the new candidate form", form.status());
        }
        return form;
    }

    /** Value of the owner option whose label equals {@code email}, ignoring case. */
    Optional<String> findOwnerId(String html, String email) {
        Document doc = Jsoup.parse(html);
        for (Element option : doc.select("select[name=\"" + OWNER_FIELD + "\"] option[value]")) {
            String value = option.attr("value").trim();
            if (!value.isEmpty() && option.text().trim().equalsIgnoreCase(email.trim())) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** Text of the first element whose class mentions "error" or "alert", whitespace collapsed. */
    Optional<String> errorMessage(String html) {
        Element box = Jsoup.parse(html).selectFirst("[class*=error], [class*=alert]");
        if (box == null) {
            return Optional.empty();
        }
        String text = box.text().replaceAll("\\s+", " ").trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private Optional<String> validate(String firstName, String lastName, String url) {
        if (firstName == null || firstName.isBlank()) return Optional.of("First name is required.");
        if (lastName == null || lastName.isBlank()) return Optional.of("Last name is required.");
        if (url == null || url.isBlank()) return Optional.of("LinkedIn URL is required.");
        return Optional.empty();
    }
}
