package com.contactbook.domain.model;

/**
 * Role of a registered user. Assigned at registration and never changed afterwards.
 */
public enum UserRole {
    USER,
    ADMIN
}
