package io.powledger.core.state;

/** Key of an unspent output: owning txid + output position. */
public record Outpoint(String txId, long outputIndex) {
    @Override public String toString() {
        return txId + ":" + outputIndex;
    }
}
