package tech.footprint.breach_api.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hashing rules shared by lookups and imports. Emails are normalized before hashing so that
 * aliases of one mailbox collapse to a single hash.
 */
public final class Hashes {

    private static final Pattern SHA1_HEX = Pattern.compile("^[A-Fa-f0-9]{40}$");
    private static final Pattern RANGE_PREFIX = Pattern.compile("^[A-Fa-f0-9]{5}$");

    public static final int PREFIX_LENGTH = 5;

    private Hashes() {
    }

    /**
     * Lower-cases and trims, drops a {@code +tag} from the local part and, for Gmail, every dot.
     */
    public static String normalizeEmail(String email) {
        String trimmed = email.trim().toLowerCase(Locale.ROOT);
        int at = trimmed.indexOf('@');
        if (at < 0) {
            return trimmed;
        }
        String local = trimmed.substring(0, at);
        String domain = trimmed.substring(at + 1);
        if (domain.equals("gmail.com") || domain.equals("googlemail.com")) {
            local = local.replace(".", "");
        }
        int plus = local.indexOf('+');
        if (plus >= 0) {
            local = local.substring(0, plus);
        }
        return local + "@" + domain;
    }

    public static String hashEmail(String email) {
        return sha256(normalizeEmail(email));
    }

    /** Lower-case hex SHA-256 of the trimmed, lower-cased input. */
    public static String sha256(String input) {
        return digest("SHA-256", input.trim().toLowerCase(Locale.ROOT));
    }

    /** Upper-case hex SHA-1, the format used by password range answers. */
    public static String sha1(String input) {
        return digest("SHA-1", input).toUpperCase(Locale.ROOT);
    }

    public static boolean isSha1Hex(String value) {
        return value != null && SHA1_HEX.matcher(value).matches();
    }

    public static boolean isRangePrefix(String value) {
        return value != null && RANGE_PREFIX.matcher(value).matches();
    }

    public static String prefixOf(String sha1Hex) {
        return sha1Hex.substring(0, PREFIX_LENGTH).toUpperCase(Locale.ROOT);
    }

    public static String suffixOf(String sha1Hex) {
        return sha1Hex.substring(PREFIX_LENGTH).toUpperCase(Locale.ROOT);
    }

    private static String digest(String algorithm, String input) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            return HexFormat.of().formatHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
