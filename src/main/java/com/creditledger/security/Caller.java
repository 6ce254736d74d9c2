package com.creditledger.security;

/**
 * Identity of the caller, resolved by the upstream gateway.
 *
 * The ledger trusts this value; it does no authentication of its own.
 */
public record Caller(
    String identity,
    CallerRole role
) {
    public Caller {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Caller identity cannot be null or empty");
        }
        if (role == null) {
            role = CallerRole.BORROWER;
        }
    }

    public static Caller borrower(String identity) {
        return new Caller(identity, CallerRole.BORROWER);
    }

    public static Caller owner(String identity) {
        return new Caller(identity, CallerRole.OWNER);
    }

    public boolean isOwner() {
        return role == CallerRole.OWNER;
    }
}
