package com.tokenrelay.common;

import java.util.regex.Pattern;

/**
 * Base58 Solana address (mint, wallet or account): 32-44 chars, no 0/O/I/l.
 */
public final class SolanaAddress {

    private static final Pattern PATTERN = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    private SolanaAddress() {
    }

    public static boolean isValid(String address) {
        return address != null && PATTERN.matcher(address).matches();
    }
}
