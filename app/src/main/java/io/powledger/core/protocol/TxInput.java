package io.powledger.core.protocol;

/**
 * Reference to an output being spent. Inputs never carry a script in this model.
 */
public record TxInput(String previousTxId, long outputIndex, long sequence) {

    public TxInput {
        if (previousTxId == null) throw new IllegalArgumentException("missing previousTxId");
    }

    public TxInput(String previousTxId, long outputIndex) {
        this(previousTxId, outputIndex, ProtocolLimits.DEFAULT_SEQUENCE);
    }

    public boolean isCoinbaseReference() {
        return ProtocolLimits.COINBASE_TXID.equals(previousTxId);
    }
}
