package com.contactbook.interfaces.api.security;

import com.contactbook.application.exceptions.UnauthenticatedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON 401 for protected requests that arrive without a bearer token.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String NOT_AUTHENTICATED = "Not authenticated";

    private final ErrorResponseWriter errorResponseWriter;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        log.debug("Unauthenticated request to {}", request.getRequestURI());
        String message = request.getHeader("Authorization") == null
            ? NOT_AUTHENTICATED
            : UnauthenticatedException.COULD_NOT_VALIDATE;
        errorResponseWriter.writeUnauthorized(request, response, message);
    }
}
