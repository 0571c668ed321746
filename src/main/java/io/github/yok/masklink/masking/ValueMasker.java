package io.github.yok.masklink.masking;

import com.google.common.base.Preconditions;
import java.util.Locale;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Pure per-value masking transforms. Every transform maps {@code null} to {@code null}.
 *
 * <p>
 * <strong>Salt rotation:</strong> {@link #hash(Object)} and {@link #preserveFormat(Object)} depend
 * on the salt. Rotating it changes every output, so previously masked data no longer matches newly
 * masked data.
 * </p>
 */
public class ValueMasker {

    private final String salt;
    private final String redactionPlaceholder;

    /**
     * Creates a masker.
     *
     * @param salt secret salt appended to normalized input before hashing
     * @param redactionPlaceholder literal returned by non-length-preserving redaction
     */
    public ValueMasker(String salt, String redactionPlaceholder) {
        this.salt = Preconditions.checkNotNull(salt, "salt must not be null");
        this.redactionPlaceholder =
                Preconditions.checkNotNull(redactionPlaceholder, "placeholder must not be null");
    }

    /**
     * Deterministic hash: trims surrounding whitespace, lowercases, appends the salt and returns
     * the SHA-256 digest as lowercase hex.
     *
     * @param value input value; rendered with {@link String#valueOf(Object)}
     * @return 64-character lowercase hex digest, or {@code null}
     */
    public String hash(Object value) {
        if (value == null) {
            return null;
        }
        String normalized = StringUtils.strip(String.valueOf(value)).toLowerCase(Locale.ROOT);
        return DigestUtils.sha256Hex(normalized + salt);
    }

    /**
     * Redaction.
     *
     * @param value input value
     * @param keepLength {@code true} to return {@code maskChar} once per input character,
     *        {@code false} to return the fixed placeholder
     * @param maskChar mask character
     * @return redacted value, or {@code null}
     */
    public String redact(Object value, boolean keepLength, char maskChar) {
        if (value == null) {
            return null;
        }
        if (!keepLength) {
            return redactionPlaceholder;
        }
        String text = String.valueOf(value);
        return StringUtils.repeat(maskChar, text.codePointCount(0, text.length()));
    }

    /**
     * Format-preserving substitution: every digit is replaced by a digit derived from the hash of
     * the input's digit sequence, every other character stays at its position.
     *
     * <p>
     * Hex digit {@code h} of the hash maps to decimal digit {@code h mod 10}. One hash supplies 64
     * digits; longer inputs take further digits from a chain of salted hashes of the previous
     * digest, so the output stays deterministic for any length.
     * </p>
     *
     * @param value input value, e.g. {@code "(555) 123-4567"}
     * @return substituted value with the same length and non-digit layout, or {@code null}
     */
    public String preserveFormat(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isDigit(c)) {
                digits.append(c);
            }
        }
        if (digits.length() == 0) {
            return text;
        }

        String replacement = digitSupply(digits.toString(), digits.length());
        StringBuilder result = new StringBuilder(text.length());
        int idx = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isDigit(c)) {
                result.append(replacement.charAt(idx++));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /**
     * Returns {@code count} decimal digits derived from the hash of {@code digits}.
     *
     * @param digits digit sequence of the input
     * @param count number of digits required
     * @return decimal digit string of length {@code count}
     */
    String digitSupply(String digits, int count) {
        StringBuilder supply = new StringBuilder(count);
        String hex = hash(digits);
        while (true) {
            for (int i = 0; i < hex.length(); i++) {
                if (supply.length() == count) {
                    return supply.toString();
                }
                supply.append(Character.forDigit(Character.digit(hex.charAt(i), 16) % 10, 10));
            }
            if (supply.length() == count) {
                return supply.toString();
            }
            hex = DigestUtils.sha256Hex(hex + salt);
        }
    }
}
