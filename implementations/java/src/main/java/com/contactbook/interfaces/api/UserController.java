package com.contactbook.interfaces.api;

import com.contactbook.application.UserService;
import com.contactbook.domain.model.Principal;
import com.contactbook.interfaces.api.dto.ErrorResponse;
import com.contactbook.interfaces.api.dto.UserResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Tag(name = "Users", description = "The caller's own account")
@SecurityRequirement(name = "bearerAuth")
public class UserController {

    private final UserService userService;

    @GetMapping(value = "/me", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Current user")
    public UserResponse me(@AuthenticationPrincipal Principal principal) {
        return UserResponse.from(principal);
    }

    @PatchMapping(
        value = "/avatar",
        consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Replace avatar", description = "Administrators only")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Avatar replaced",
            content = @Content(schema = @Schema(implementation = UserResponse.class))),
        @ApiResponse(responseCode = "403", description = "Caller is not an administrator",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "502", description = "Image host failed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public UserResponse updateAvatar(@RequestParam("file") MultipartFile file,
                                     @AuthenticationPrincipal Principal principal) throws IOException {
        try (InputStream image = file.getInputStream()) {
            return UserResponse.from(userService.updateAvatar(principal, image));
        }
    }
}
