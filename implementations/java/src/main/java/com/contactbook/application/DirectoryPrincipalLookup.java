package com.contactbook.application;

import com.contactbook.domain.model.Principal;
import com.contactbook.domain.repository.UserDirectory;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Uncached lookup straight against the user directory.
 */
@RequiredArgsConstructor
public class DirectoryPrincipalLookup implements PrincipalLookup {

    private final UserDirectory userDirectory;

    @Override
    public Optional<Principal> findByUsername(String username) {
        return userDirectory.findByUsername(username).map(Principal::of);
    }
}
