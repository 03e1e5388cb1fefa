package com.bulut.common;

import com.bulut.common.exception.InvalidFormatException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for wallet addresses and aliases.
 *
 * Every address or alias that enters the system goes through here before it
 * is compared or stored:
 * - addresses: trimmed, lower-cased, {@code 0x} followed by 40 hex digits
 * - aliases: trimmed, leading {@code @} stripped, lower-cased, 3-20 of
 *   {@code [a-z0-9_]}
 */
public final class AddressCodec {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");
    private static final Pattern ALIAS = Pattern.compile("^[a-z0-9_]{3,20}$");
    private static final Pattern ALIAS_PREFIX = Pattern.compile("^[a-z0-9_]{0,20}$");

    private AddressCodec() {
    }

    public static String normalize(String address) {
        if (address == null) {
            throw new InvalidFormatException("Address is required");
        }
        String canonical = address.trim().toLowerCase(Locale.ROOT);
        if (canonical.isEmpty()) {
            throw new InvalidFormatException("Address is required");
        }
        if (!ADDRESS.matcher(canonical).matches()) {
            throw new InvalidFormatException("Address must be 0x followed by 40 hex characters");
        }
        return canonical;
    }

    public static String normalizeAlias(String alias) {
        if (alias == null) {
            throw new InvalidFormatException("Alias is required");
        }
        String canonical = stripAt(alias.trim()).toLowerCase(Locale.ROOT).trim();
        if (!ALIAS.matcher(canonical).matches()) {
            throw new InvalidFormatException("Alias must be 3-20 letters, digits or underscores");
        }
        return canonical;
    }

    /**
     * Canonical form of a search prefix. Shorter than a full alias is allowed.
     */
    public static String normalizeAliasPrefix(String prefix) {
        if (prefix == null) {
            return "";
        }
        String canonical = stripAt(prefix.trim()).toLowerCase(Locale.ROOT).trim();
        if (!ALIAS_PREFIX.matcher(canonical).matches()) {
            throw new InvalidFormatException("Search query must be letters, digits or underscores");
        }
        return canonical;
    }

    public static boolean isAddress(String address) {
        return address != null && ADDRESS.matcher(address.trim().toLowerCase(Locale.ROOT)).matches();
    }

    public static boolean isAlias(String alias) {
        if (alias == null) {
            return false;
        }
        return ALIAS.matcher(stripAt(alias.trim()).toLowerCase(Locale.ROOT).trim()).matches();
    }

    /**
     * Display form of a canonical alias.
     */
    public static String display(String canonicalAlias) {
        return "@" + canonicalAlias;
    }

    private static String stripAt(String value) {
        return value.startsWith("@") ? value.substring(1) : value;
    }
}
