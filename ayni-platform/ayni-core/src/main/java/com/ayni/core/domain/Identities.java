package com.ayni.core.domain;

import com.ayni.core.error.LedgerError;
import com.ayni.core.error.LedgerException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Participant identities are EVM-style addresses, stored lower-case.
 */
public final class Identities {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Identities() {}

    public static boolean isValid(String identity) {
        return identity != null
                && ADDRESS.matcher(identity).matches()
                && !ZERO_ADDRESS.equalsIgnoreCase(identity);
    }

    /**
     * Normalises an identity, rejecting null, malformed and zero addresses.
     */
    public static String require(String identity) {
        if (!isValid(identity)) {
            throw LedgerException.of(LedgerError.INVALID_ADDRESS, "Invalid identity: " + identity);
        }
        return identity.toLowerCase(Locale.ROOT);
    }

    public static boolean same(String a, String b) {
        return a != null && a.equalsIgnoreCase(b);
    }
}
