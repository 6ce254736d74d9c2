package com.creditledger.controller;

import com.creditledger.security.Caller;
import com.creditledger.security.CallerRole;

import java.util.Locale;

/**
 * Headers set by the upstream gateway after authentication.
 */
final class CallerHeaders {

    static final String CALLER_ID = "X-Caller-Id";
    static final String CALLER_ROLE = "X-Caller-Role";

    private CallerHeaders() {
    }

    static Caller resolve(String identity, String role) {
        CallerRole callerRole = role == null || role.isBlank()
                ? CallerRole.BORROWER
                : CallerRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        return new Caller(identity, callerRole);
    }
}
