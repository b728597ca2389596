package uk.gegc.creditledger.features.wallet.domain.exception;

public class InvalidAmountException extends RuntimeException {

    private final String field;
    private final long value;

    public InvalidAmountException(String field, long value) {
        super(field + " must be greater than 0, was " + value);
        this.field = field;
        this.value = value;
    }

    public InvalidAmountException(String field, long value, String message) {
        super(message);
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public long getValue() {
        return value;
    }
}
