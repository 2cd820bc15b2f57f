package io.powledger.core.state;

/** A block's inputs could not all be spent against the current output set; nothing was applied. */
public final class BlockRejectedException extends IllegalStateException {
    private final transient Outpoint conflict;

    public BlockRejectedException(String message, Outpoint conflict) {
        super(message);
        this.conflict = conflict;
    }

    public Outpoint conflict() {
        return conflict;
    }
}
