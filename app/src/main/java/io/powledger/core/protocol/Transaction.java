package io.powledger.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Demonstration UTXO transaction: version, inputs, outputs, locktime.
 * <p>
 * {@code note} and {@code fee} are descriptive metadata for display; they are not
 * part of the canonical encoding and do not affect the txid.
 * The txid is derived at construction, so an instance that cannot be encoded never exists.
 */
public final class Transaction {

    private final int version;
    private final List<TxInput> inputs;
    private final List<TxOutput> outputs;
    private final long locktime;

    private final boolean coinbase;
    private final String note;
    private final long fee;

    private final String txid;

    private Transaction(int version,
                        List<TxInput> inputs,
                        List<TxOutput> outputs,
                        long locktime,
                        boolean coinbase,
                        String note,
                        long fee) {
        this.version = version;
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.locktime = locktime;
        this.coinbase = coinbase;
        this.note = note;
        this.fee = fee;
        byte[] encoded = TransactionCodec.encode(this);
        this.txid = coinbase ? ProtocolLimits.COINBASE_TXID : TransactionCodec.txidOf(encoded);
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Subsidy transaction: a single sentinel input and one output to {@code recipientScript}.
     * Its id is forced to the sentinel rather than derived.
     */
    public static Transaction coinbase(long subsidy, byte[] recipientScript) {
        return builder()
                .input(new TxInput(ProtocolLimits.COINBASE_TXID, ProtocolLimits.COINBASE_OUTPUT_INDEX))
                .output(new TxOutput(subsidy, recipientScript))
                .coinbase(true)
                .note("Coinbase reward")
                .build();
    }

    public static final class Builder {
        private int version = ProtocolLimits.TX_VERSION;
        private final List<TxInput> inputs = new ArrayList<>();
        private final List<TxOutput> outputs = new ArrayList<>();
        private long locktime = ProtocolLimits.TX_LOCKTIME;
        private boolean coinbase;
        private String note;
        private long fee;

        public Builder version(int v) { this.version = v; return this; }
        public Builder input(TxInput in) { this.inputs.add(in); return this; }
        public Builder inputs(List<TxInput> in) { this.inputs.addAll(in); return this; }
        public Builder output(TxOutput out) { this.outputs.add(out); return this; }
        public Builder outputs(List<TxOutput> out) { this.outputs.addAll(out); return this; }
        public Builder locktime(long lt) { this.locktime = lt; return this; }
        public Builder coinbase(boolean c) { this.coinbase = c; return this; }
        public Builder note(String n) { this.note = n; return this; }
        public Builder fee(long f) { this.fee = f; return this; }

        public Transaction build() {
            return new Transaction(version, inputs, outputs, locktime, coinbase, note, fee);
        }
    }

    public int version() { return version; }
    public List<TxInput> inputs() { return inputs; }
    public List<TxOutput> outputs() { return outputs; }
    public long locktime() { return locktime; }
    public boolean isCoinbase() { return coinbase; }
    public String note() { return note; }
    public long fee() { return fee; }
    public String txid() { return txid; }

    @Override public String toString() {
        return "Transaction{txid=" + txid.substring(0, 8) + "…, in=" + inputs.size() + ", out=" + outputs.size() + "}";
    }
}
