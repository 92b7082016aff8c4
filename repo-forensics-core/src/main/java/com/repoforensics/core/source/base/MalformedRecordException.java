package com.repoforensics.core.source.base;

/**
 * Thrown when a single input row cannot be decoded.
 *
 * <p>The row is skipped and counted; loading continues with the next row.
 */
public class MalformedRecordException extends Exception {

    private final String reason;

    /**
     * Creates a malformed record exception.
     *
     * @param reason short, stable reason used to group skips (e.g. "invalid number")
     * @param message detailed message
     */
    public MalformedRecordException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * Returns the short reason used to group skipped rows.
     *
     * @return skip reason
     */
    public String getReason() {
        return reason;
    }
}
