package com.luanvv.parker.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LookupResult.Found.class, name = "found"),
    @JsonSubTypes.Type(value = LookupResult.NotFound.class, name = "not_found"),
    @JsonSubTypes.Type(value = LookupResult.AuthError.class, name = "auth_error"),
    @JsonSubTypes.Type(value = LookupResult.NetworkError.class, name = "network_error")
})
public sealed interface LookupResult {

    record Found(CandidateRecord candidate) implements LookupResult {
    }

    record NotFound() implements LookupResult {
    }

    record AuthError(String message) implements LookupResult {
    }

    record NetworkError(String message) implements LookupResult {
    }

    default boolean isFound() {
        return this instanceof Found;
    }
}
