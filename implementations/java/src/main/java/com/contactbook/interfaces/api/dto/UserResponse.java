package com.contactbook.interfaces.api.dto;

import com.contactbook.domain.model.Principal;
import com.contactbook.domain.model.UserAccount;
import com.contactbook.domain.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of an account. Never carries the password hash.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private Long id;
    private String username;
    private String email;
    private String avatar;
    private UserRole role;

    public static UserResponse from(UserAccount user) {
        return new UserResponse(user.getId(), user.getUsername(), user.getEmail(),
            user.getAvatarUrl(), user.getRole());
    }

    public static UserResponse from(Principal principal) {
        return new UserResponse(principal.getId(), principal.getUsername(), principal.getEmail(),
            principal.getAvatarUrl(), principal.getRole());
    }
}
