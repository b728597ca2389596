package uk.gegc.creditledger.features.wallet.domain.exception;

/**
 * Thrown when a cost does not fit into subscription + top-up + remaining grace.
 * {@code available} reports subscription + top-up only; grace is not exposed to callers.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final int required;
    private final long available;

    public InsufficientCreditsException(int required, long available) {
        super("Insufficient credits: required=" + required + ", available=" + available);
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }
}
