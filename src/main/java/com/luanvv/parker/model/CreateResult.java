package com.luanvv.parker.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CreateResult.Created.class, name = "created"),
    @JsonSubTypes.Type(value = CreateResult.AlreadyExists.class, name = "already_exists"),
    @JsonSubTypes.Type(value = CreateResult.ValidationError.class, name = "validation_error"),
    @JsonSubTypes.Type(value = CreateResult.AuthError.class, name = "auth_error"),
    @JsonSubTypes.Type(value = CreateResult.NetworkError.class, name = "network_error")
})
public sealed interface CreateResult {

    record Created(CandidateRecord candidate) implements CreateResult {
    }

    /** The existence check already resolved to a record; nothing was submitted. */
    record AlreadyExists(CandidateRecord candidate) implements CreateResult {
    }

    record ValidationError(String message) implements CreateResult {
    }

    record AuthError(String message) implements CreateResult {
    }

    record NetworkError(String message) implements CreateResult {
    }

    default boolean isSuccess() {
        return this instanceof Created || this instanceof AlreadyExists;
    }
}
