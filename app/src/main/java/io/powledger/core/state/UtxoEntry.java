package io.powledger.core.state;

/**
 * One registered output. Entries are never removed; spending flips {@code spent}
 * by replacing the entry with {@link #asSpent()}.
 */
public record UtxoEntry(String owningTxId, long outputIndex, long value, String scriptHex, boolean spent) {

    public Outpoint outpoint() {
        return new Outpoint(owningTxId, outputIndex);
    }

    UtxoEntry asSpent() {
        return new UtxoEntry(owningTxId, outputIndex, value, scriptHex, true);
    }
}
