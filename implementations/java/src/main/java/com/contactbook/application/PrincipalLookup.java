package com.contactbook.application;

import com.contactbook.domain.model.Principal;

import java.util.Optional;

/**
 * Resolves a username to the principal snapshot used for request authorization.
 */
public interface PrincipalLookup {

    Optional<Principal> findByUsername(String username);
}
