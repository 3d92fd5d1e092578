package com.contactbook.interfaces.api;

import com.contactbook.interfaces.api.dto.MessageResponse;
import com.contactbook.interfaces.api.exception.DatabaseUnavailableException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe that also proves the database answers.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Health")
public class HealthController {

    static final String HEALTHY = "Welcome to the contact book!";
    static final String DATABASE_UNREACHABLE = "Error connecting to the database";

    private final JdbcTemplate jdbcTemplate;

    @GetMapping(value = "/healthchecker", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Check database connection")
    public MessageResponse healthchecker() {
        Integer one;
        try {
            one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            log.error("Database connection failed", e);
            throw new DatabaseUnavailableException(DATABASE_UNREACHABLE, e);
        }
        if (one == null || one != 1) {
            throw new DatabaseUnavailableException("Database is not configured correctly", null);
        }
        return new MessageResponse(HEALTHY);
    }
}
