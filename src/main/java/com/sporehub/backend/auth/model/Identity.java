package com.sporehub.backend.auth.model;

/**
 * The authenticated caller, attached to the request once the access guard has passed.
 */
public record Identity(String subjectId, String email, Role role) {
}
