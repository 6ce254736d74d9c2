package com.creditledger.security;

/**
 * Role of an already-authenticated caller.
 */
public enum CallerRole {
    OWNER,      // Platform operator: may approve and disburse
    BORROWER    // Everyone else
}
