package com.ayni.core.domain;

/**
 * Capabilities an identity can hold.
 */
public enum Role {
    ADMIN,
    DONOR,
    NONPROFIT
}
