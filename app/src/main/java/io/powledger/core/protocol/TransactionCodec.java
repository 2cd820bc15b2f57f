package io.powledger.core.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Canonical little-endian transaction encoding:
 * <pre>
 * version(4) | nIn(1) | { prevTxId reversed(32) | index(4) | scriptLen=0(1) | sequence(4) }*
 *            | nOut(1) | { value(8) | scriptLen(1) | script }* | locktime(4)
 * </pre>
 * Counts and script lengths are single bytes, not varints.
 */
public final class TransactionCodec {
    private TransactionCodec(){}

    public static byte[] encode(Transaction tx) {
        if (tx.inputs().size() > ProtocolLimits.MAX_INPUTS) {
            throw new EncodingOverflowException("too many inputs: " + tx.inputs().size());
        }
        if (tx.outputs().size() > ProtocolLimits.MAX_OUTPUTS) {
            throw new EncodingOverflowException("too many outputs: " + tx.outputs().size());
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(estimateSize(tx));
        writeUInt32(out, tx.version(), "version");
        out.write(tx.inputs().size());
        for (TxInput in : tx.inputs()) {
            out.writeBytes(previousTxIdBytes(in.previousTxId()));
            writeUInt32(out, in.outputIndex(), "outputIndex");
            out.write(0);
            writeUInt32(out, in.sequence(), "sequence");
        }
        out.write(tx.outputs().size());
        for (TxOutput o : tx.outputs()) {
            if (o.scriptLength() > ProtocolLimits.MAX_SCRIPT_BYTES) {
                throw new EncodingOverflowException("script too long: " + o.scriptLength() + " bytes");
            }
            out.writeBytes(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(o.value()).array());
            out.write(o.scriptLength());
            out.writeBytes(o.script());
        }
        writeUInt32(out, tx.locktime(), "locktime");
        return out.toByteArray();
    }

    /** Double SHA-256 of the encoding, byte-reversed, as hex. */
    public static String txidOf(byte[] encoded) {
        return Hex.encodeReversed(Hashes.doubleSha256(encoded));
    }

    public static String txid(Transaction tx) {
        return txidOf(encode(tx));
    }

    private static byte[] previousTxIdBytes(String txid) {
        if (txid.length() != ProtocolLimits.TXID_HEX_LENGTH) {
            throw new IllegalArgumentException("previousTxId must be " + ProtocolLimits.TXID_HEX_LENGTH
                    + " hex characters, got " + txid.length());
        }
        return Hex.decodeReversed(txid);
    }

    private static void writeUInt32(ByteArrayOutputStream out, long v, String field) {
        if (v < 0 || v > ProtocolLimits.MAX_UINT32) {
            throw new IllegalArgumentException(field + " out of uint32 range: " + v);
        }
        out.writeBytes(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt((int) v).array());
    }

    private static int estimateSize(Transaction tx) {
        int size = 4 + 1 + tx.inputs().size() * 41 + 1 + 4;
        for (TxOutput o : tx.outputs()) size += 9 + o.scriptLength();
        return size;
    }
}
