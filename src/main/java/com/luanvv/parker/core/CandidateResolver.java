package com.luanvv.parker.core;

import com.luanvv.parker.model.CandidateRecord;
import com.luanvv.parker.model.LookupResult;
import com.luanvv.parker.model.ProfileRef;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the CRM record for a LinkedIn profile: the CRM's URL check first, then a name search per
 * slug token, then a search on the name hints. A failing step counts as no match.
 */
@Slf4j
@RequiredArgsConstructor
public class CandidateResolver {
    private final CrmHttpClient http;
    private final SessionAuthenticator authenticator;
    private final FormTokenExtractor tokens;
    private final PageDataExtractor pages;
    private final SearchResultMatcher matcher;

    public LookupResult lookup(String url, String firstNameHint, String lastNameHint) {
        return lookup(ProfileRef.of(url, firstNameHint, lastNameHint));
    }

    public LookupResult lookup(ProfileRef profile) {
        try {
            if (profile.url() == null || profile.url().isBlank()) {
                log.warn("Lookup called without a profile URL");
                return new LookupResult.NotFound();
            }
            if (!authenticator.ensureSession()) {
                return new LookupResult.AuthError(
                    "Not authenticated with the CRM. Configure credentials and sign in.");
            }

            List<Attempt> attempts = new ArrayList<>();
            Attempt direct = record(attempts, "url-check", directCheck(profile.url()));
            if (direct.matched()) return found(direct, profile);

            Attempt slug = record(attempts, "slug-search", search(ProfileUrls.tokensFromUrl(profile.url()), profile.url()));
            if (slug.matched()) return found(slug, profile);

            if (profile.hasNameHints()) {
                List<String> terms = new ArrayList<>(2);
                profile.firstNameHint().ifPresent(terms::add);
                profile.lastNameHint().ifPresent(terms::add);
                Attempt named = record(attempts, "name-search", search(terms, profile.url()));
                if (named.matched()) return found(named, profile);
            }

            if (attempts.stream().allMatch(Attempt::faulted)) {
                log.warn("Every lookup strategy failed for {}; reporting no match", profile.url());
                return new LookupResult.NotFound();
            }
            log.info("No CRM record for {}", profile.url());
            return new LookupResult.NotFound();
        } catch (Exception e) {
            log.error("Lookup failed for {}", profile.url(), e);
            return new LookupResult.NetworkError(e.getMessage() != null ? e.getMessage() : "Failed to look up candidate.");
        }
    }

    // The CRM's LinkedIn URL check redirects straight to the record when one exists.
    Attempt directCheck(String profileUrl) {
        try {
            CrmResponse checkPage = http.get(CrmPaths.LINKEDIN_URL_CHECK);
            if (!checkPage.ok()) {
                return Attempt.noMatch();
            }
            Map<String, String> form = new LinkedHashMap<>();
            form.put(CrmPaths.TOKEN_FIELD, tokens.requireToken(checkPage.body(), "LinkedIn URL check page"));
            form.put("linkedin_url", profileUrl);
            CrmResponse result = http.postForm(CrmPaths.CHECK_LINKEDIN_URL, form);
            if (result.ok() && result.isDetailPage()) {
                return Attempt.match(pages.parse(result.body(), result.url()));
            }
            return Attempt.noMatch();
        } catch (RuntimeException e) {
            log.warn("URL check failed for {}: {}", profileUrl, e.toString());
            return Attempt.fault();
        }
    }

    Attempt search(List<String> terms, String profileUrl) {
        if (terms.isEmpty()) {
            return Attempt.skipped();
        }
        int faults = 0;
        for (String term : terms) {
            try {
                Optional<CandidateRecord> hit = searchTerm(term, profileUrl);
                if (hit.isPresent()) {
                    return Attempt.match(hit.get());
                }
            } catch (RuntimeException e) {
                faults++;
                log.warn("Search for '{}' failed: {}", term, e.toString());
            }
        }
        return faults == terms.size() ? Attempt.fault() : Attempt.noMatch();
    }

    private Optional<CandidateRecord> searchTerm(String term, String profileUrl) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put(CrmPaths.SEARCH_PARAM, term);
        query.put("commit", "Search");
        CrmResponse results = http.get(CrmPaths.CANDIDATES, query);
        if (!results.ok()) {
            throw new CrmNetworkException("Candidate search for '" + term + "' failed", results.status());
        }
        Optional<String> path = matcher.findCandidatePath(results.body(), profileUrl);
        if (path.isEmpty()) {
            log.debug("No row for {} in results for '{}'", profileUrl, term);
            return Optional.empty();
        }
        CrmResponse detail = http.get(path.get());
        if (!detail.ok()) {
            throw new CrmNetworkException("Candidate page " + path.get() + " failed", detail.status());
        }
        return Optional.of(pages.parse(detail.body(), detail.url()));
    }

    private Attempt record(List<Attempt> attempts, String strategy, Attempt attempt) {
        log.debug("Strategy {} -> {}", strategy, attempt.outcome());
        if (attempt.outcome() != Outcome.SKIPPED) {
            attempts.add(attempt);
        }
        return attempt;
    }

    private LookupResult found(Attempt attempt, ProfileRef profile) {
        CandidateRecord candidate = attempt.candidate().withLinkedinUrlIfAbsent(profile.url());
        log.info("Found CRM record {} for {}", candidate.id(), profile.url());
        return new LookupResult.Found(candidate);
    }

    enum Outcome { MATCH, NO_MATCH, FAULT, SKIPPED }

    record Attempt(Outcome outcome, CandidateRecord candidate) {
        static Attempt match(CandidateRecord candidate) {
            return new Attempt(Outcome.MATCH, candidate);
        }

        static Attempt noMatch() {
            return new Attempt(Outcome.NO_MATCH, null);
        }

        static Attempt fault() {
            return new Attempt(Outcome.FAULT, null);
        }

        static Attempt skipped() {
            return new Attempt(Outcome.SKIPPED, null);
        }

        boolean matched() {
            return outcome == Outcome.MATCH;
        }

        boolean faulted() {
            return outcome == Outcome.FAULT;
        }
    }
}
