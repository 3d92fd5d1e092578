package com.contactbook.application;

/**
 * Sign-up data as submitted, with the plaintext password.
 */
public record Registration(String username, String email, String password) {

    @Override
    public String toString() {
        return "Registration[username=" + username + ", password=***]";
    }
}
