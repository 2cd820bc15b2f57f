package io.powledger.core.chainio;

/** Chain file content was not recognized as JSON, YAML or the plain-text export. */
public final class MalformedChainException extends IllegalArgumentException {
    public MalformedChainException(String message) {
        super(message);
    }

    public MalformedChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
