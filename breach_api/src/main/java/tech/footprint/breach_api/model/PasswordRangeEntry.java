package tech.footprint.breach_api.model;

/**
 * One line of a k-anonymity range answer.
 */
public record PasswordRangeEntry(String suffix, long count) {

    public String toLine() {
        return suffix + ":" + count;
    }
}
