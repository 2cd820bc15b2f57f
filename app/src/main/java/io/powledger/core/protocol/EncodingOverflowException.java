package io.powledger.core.protocol;

/** A transaction field does not fit its fixed-width slot in the canonical encoding. */
public final class EncodingOverflowException extends IllegalArgumentException {
    public EncodingOverflowException(String message) {
        super(message);
    }
}
