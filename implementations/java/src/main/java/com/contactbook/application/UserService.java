package com.contactbook.application;

import com.contactbook.domain.model.Principal;
import com.contactbook.domain.model.UserAccount;
import com.contactbook.domain.repository.UserDirectory;
import com.contactbook.infrastructure.avatar.AvatarStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;

/**
 * Operations on the caller's own account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final IdentityService identityService;
    private final UserDirectory userDirectory;
    private final AvatarStorage avatarStorage;

    /**
     * Upload a new avatar for an administrator and store its URL.
     *
     * @throws com.contactbook.application.exceptions.ForbiddenException if the caller is not an admin
     * @throws com.contactbook.application.exceptions.ExternalServiceException if the image host fails
     */
    public UserAccount updateAvatar(Principal principal, InputStream image) {
        identityService.requireAdmin(principal);

        String url = avatarStorage.upload(image, principal.getUsername());
        UserAccount updated = userDirectory.updateAvatar(principal.getEmail(), url);
        log.info("Avatar replaced: userId={}", updated.getId());
        return updated;
    }
}
