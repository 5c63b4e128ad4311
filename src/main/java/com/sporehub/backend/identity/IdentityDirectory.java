package com.sporehub.backend.identity;

import com.sporehub.backend.auth.model.Identity;

import java.util.Optional;

/**
 * Looks up the account behind an email address.
 */
public interface IdentityDirectory {

    Optional<Identity> findByEmail(String email);
}
