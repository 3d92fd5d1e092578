package com.contactbook.interfaces.api;

import com.contactbook.application.AuthWorkflow;
import com.contactbook.application.Registration;
import com.contactbook.domain.model.UserAccount;
import com.contactbook.interfaces.api.dto.EmailRequest;
import com.contactbook.interfaces.api.dto.ErrorResponse;
import com.contactbook.interfaces.api.dto.MessageResponse;
import com.contactbook.interfaces.api.dto.RegisterRequest;
import com.contactbook.interfaces.api.dto.ResetPasswordRequest;
import com.contactbook.interfaces.api.dto.TokenResponse;
import com.contactbook.interfaces.api.dto.UserResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Sign-up, login, email confirmation and password reset.
 *
 * All endpoints are public; the tokens they accept are carried in the path.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Auth", description = "Account registration and credentials")
public class AuthController {

    private final AuthWorkflow authWorkflow;

    @PostMapping(
        value = "/register",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register a new user", description = "Creates an unconfirmed account and emails a confirmation link")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "User registered",
            content = @Content(schema = @Schema(implementation = UserResponse.class))),
        @ApiResponse(responseCode = "409", description = "Username or email already registered",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public UserResponse register(@Valid @RequestBody RegisterRequest request) {
        UserAccount account = authWorkflow.register(
            new Registration(request.getUsername(), request.getEmail(), request.getPassword()));
        return UserResponse.from(account);
    }

    /**
     * OAuth2 password-grant style login from a form-encoded body.
     */
    @PostMapping(
        value = "/login",
        consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Log in", description = "Exchanges username and password for a bearer token")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Authenticated",
            content = @Content(schema = @Schema(implementation = TokenResponse.class))),
        @ApiResponse(responseCode = "401", description = "Invalid credentials or email not confirmed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public TokenResponse login(@RequestParam("username") String username,
                               @RequestParam("password") String password) {
        return TokenResponse.bearer(authWorkflow.login(username, password));
    }

    @GetMapping(value = "/confirmed_email/{token}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Confirm email", description = "Applies the token sent in the confirmation email")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Confirmed, or already confirmed"),
        @ApiResponse(responseCode = "400", description = "No account for the token's email",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "422", description = "Invalid email verification token",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public MessageResponse confirmEmail(@PathVariable("token") String token) {
        return new MessageResponse(authWorkflow.confirmEmail(token));
    }

    @PostMapping(
        value = "/request_email",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Re-send confirmation email")
    public MessageResponse requestEmail(@Valid @RequestBody EmailRequest request) {
        return new MessageResponse(authWorkflow.requestConfirmationEmail(request.getEmail()));
    }

    @PostMapping(
        value = "/reset_password",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Request password reset",
        description = "Emails a link that applies the new password; replies the same whether or not the email is known")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Request accepted"),
        @ApiResponse(responseCode = "400", description = "Email address not confirmed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public MessageResponse requestPasswordReset(@Valid @RequestBody ResetPasswordRequest request) {
        return new MessageResponse(authWorkflow.requestPasswordReset(request.getEmail(), request.getPassword()));
    }

    @GetMapping(value = "/confirm_reset_password/{token}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Apply password reset")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Password changed"),
        @ApiResponse(responseCode = "400", description = "Invalid or expired token",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "No account for the token's email",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public MessageResponse confirmPasswordReset(@PathVariable("token") String token) {
        return new MessageResponse(authWorkflow.confirmPasswordReset(token));
    }
}
