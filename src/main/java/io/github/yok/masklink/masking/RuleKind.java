package io.github.yok.masklink.masking;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of masking rule kinds.
 *
 * <p>
 * Rule names from configuration are parsed with {@link #parse(String)}, which accepts a few
 * historical aliases and rejects everything else, so a misspelled rule fails the run at startup
 * instead of silently copying the column in clear.
 * </p>
 */
public enum RuleKind {
    // Salted SHA-256 of the normalized value, lowercase hex
    HASH,
    // Fixed placeholder, or one mask character per input character
    REDACT,
    // Digits replaced by hash-derived digits, every other character kept in place
    PRESERVE_FORMAT,
    // Stable opaque token from the token vault
    TOKENIZE,
    // Explicit pass-through
    NONE;

    private static final Map<String, RuleKind> NAMES = ImmutableMap.<String, RuleKind>builder()
            .put("hash", HASH).put("deterministic_hash", HASH).put("deterministic-hash", HASH)
            .put("redact", REDACT).put("redaction", REDACT)
            .put("preserve-format", PRESERVE_FORMAT).put("preserve_format", PRESERVE_FORMAT)
            .put("preserve_phone_format", PRESERVE_FORMAT)
            .put("tokenize", TOKENIZE)
            .put("none", NONE)
            .build();

    /**
     * Parses a configured rule name.
     *
     * @param name rule name (case-insensitive, surrounding whitespace ignored)
     * @return rule kind
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    public static RuleKind parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Masking rule name must not be blank");
        }
        RuleKind kind = NAMES.get(name.trim().toLowerCase(Locale.ROOT));
        if (kind == null) {
            throw new IllegalArgumentException(
                    "Unknown masking rule '" + name + "'. Supported: " + NAMES.keySet());
        }
        return kind;
    }
}
