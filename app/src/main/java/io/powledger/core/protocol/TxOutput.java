package io.powledger.core.protocol;

import java.util.Arrays;

public final class TxOutput {
    private final long value;
    private final byte[] script;

    public TxOutput(long value, byte[] script) {
        if (value < 0) throw new IllegalArgumentException("output value must be >= 0");
        this.value = value;
        this.script = script != null ? script.clone() : new byte[0];
    }

    public static TxOutput ofScriptHex(long value, String scriptHex) {
        return new TxOutput(value, Hex.decode(scriptHex));
    }

    public long value() { return value; }
    public byte[] script() { return script.clone(); }
    public int scriptLength() { return script.length; }
    public String scriptHex() { return Hex.encode(script); }

    @Override public boolean equals(Object o) {
        if (!(o instanceof TxOutput)) return false;
        TxOutput other = (TxOutput) o;
        return value == other.value && Arrays.equals(script, other.script);
    }
    @Override public int hashCode() { return 31 * Long.hashCode(value) + Arrays.hashCode(script); }
    @Override public String toString() { return "TxOutput{value=" + value + ", script=" + scriptHex() + "}"; }
}
