package com.luanvv.parker.model;

import java.util.Optional;

public record ProfileRef(String url, Optional<String> firstNameHint, Optional<String> lastNameHint) {

    public ProfileRef {
        firstNameHint = clean(firstNameHint);
        lastNameHint = clean(lastNameHint);
    }

    public static ProfileRef of(String url) {
        return new ProfileRef(url, Optional.empty(), Optional.empty());
    }

    public static ProfileRef of(String url, String firstNameHint, String lastNameHint) {
        return new ProfileRef(url, Optional.ofNullable(firstNameHint), Optional.ofNullable(lastNameHint));
    }

    public boolean hasNameHints() {
        return firstNameHint.isPresent() || lastNameHint.isPresent();
    }

    private static Optional<String> clean(Optional<String> hint) {
        if (hint == null) return Optional.empty();
        return hint.map(String::trim).filter(s -> !s.isEmpty());
    }
}
