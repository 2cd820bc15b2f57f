package io.powledger.core.protocol;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionCodecTest {

    private static final String PREV = sequentialTxid();
    private static final String SCRIPT = "76a9141d0f172a0ecb48aee1be1f2687d2963ae33f71a188ac";

    @Test
    void encodesFieldsInCanonicalOrder() {
        Transaction tx = Transaction.builder()
                .input(new TxInput(PREV, 2))
                .output(TxOutput.ofScriptHex(1000, SCRIPT))
                .build();

        byte[] enc = TransactionCodec.encode(tx);

        assertEquals(4 + 1 + 41 + 1 + (8 + 1 + 25) + 4, enc.length);
        assertArrayEquals(new byte[] {1, 0, 0, 0}, slice(enc, 0, 4), "version LE");
        assertEquals(1, enc[4], "input count");
        assertEquals(0x20, enc[5], "previous txid is written byte-reversed");
        assertEquals(0x01, enc[36]);
        assertArrayEquals(new byte[] {2, 0, 0, 0}, slice(enc, 37, 4), "output index LE");
        assertEquals(0, enc[41], "empty input script placeholder");
        assertArrayEquals(new byte[] {-1, -1, -1, -1}, slice(enc, 42, 4), "default sequence");
        assertEquals(1, enc[46], "output count");
        assertArrayEquals(new byte[] {(byte) 0xe8, 0x03, 0, 0, 0, 0, 0, 0}, slice(enc, 47, 8), "value LE");
        assertEquals(25, enc[55], "script length");
        assertEquals(SCRIPT, Hex.encode(slice(enc, 56, 25)));
        assertArrayEquals(new byte[] {0, 0, 0, 0}, slice(enc, 81, 4), "locktime");
    }

    @Test
    void txidIsReversedDoubleSha256OfEncoding() {
        Transaction tx = sampleBuilder().build();
        String expected = Hex.encodeReversed(Hashes.doubleSha256(TransactionCodec.encode(tx)));
        assertEquals(expected, tx.txid());
        assertEquals(ProtocolLimits.TXID_HEX_LENGTH, tx.txid().length());
    }

    @Test
    void identicalFieldsGiveIdenticalTxid() {
        Transaction a = sampleBuilder().build();
        Transaction b = sampleBuilder().build();
        assertEquals(a.txid(), b.txid());
        assertEquals(a.txid(), TransactionCodec.txid(b));
    }

    @Test
    void metadataDoesNotAffectTxid() {
        Transaction plain = sampleBuilder().build();
        Transaction annotated = sampleBuilder().note("Eve buys coffee").fee(10_000).build();
        assertEquals(plain.txid(), annotated.txid());
    }

    @Test
    void anyEncodedFieldChangesTxid() {
        Transaction base = sampleBuilder().build();
        Transaction otherSequence = Transaction.builder()
                .input(new TxInput(PREV, 0, 0))
                .output(TxOutput.ofScriptHex(5000, SCRIPT))
                .build();
        Transaction otherValue = Transaction.builder()
                .input(new TxInput(PREV, 0))
                .output(TxOutput.ofScriptHex(5001, SCRIPT))
                .build();
        assertNotEquals(base.txid(), otherSequence.txid());
        assertNotEquals(base.txid(), otherValue.txid());
    }

    @Test
    void scriptLongerThan255BytesOverflows() {
        assertDoesNotThrow(() -> Transaction.builder()
                .input(new TxInput(PREV, 0))
                .output(new TxOutput(1, new byte[255]))
                .build());
        assertThrows(EncodingOverflowException.class, () -> Transaction.builder()
                .input(new TxInput(PREV, 0))
                .output(new TxOutput(1, new byte[256]))
                .build());
    }

    @Test
    void moreThan255OutputsOverflows() {
        List<TxOutput> outputs = new ArrayList<>();
        for (int i = 0; i < 256; i++) outputs.add(new TxOutput(1, new byte[0]));
        Transaction.Builder builder = Transaction.builder().input(new TxInput(PREV, 0)).outputs(outputs);
        assertThrows(EncodingOverflowException.class, builder::build);
    }

    @Test
    void moreThan255InputsOverflows() {
        Transaction.Builder builder = Transaction.builder().output(new TxOutput(1, new byte[0]));
        for (int i = 0; i < 256; i++) builder.input(new TxInput(PREV, i));
        assertThrows(EncodingOverflowException.class, builder::build);
    }

    @Test
    void rejectsMalformedPreviousTxid() {
        Transaction.Builder builder = Transaction.builder()
                .input(new TxInput("abcd", 0))
                .output(new TxOutput(1, new byte[0]));
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void coinbaseCarriesSentinelIdentifier() {
        Transaction coinbase = Transaction.coinbase(5_000_000_000L, Hex.decode(SCRIPT));
        assertTrue(coinbase.isCoinbase());
        assertEquals(ProtocolLimits.COINBASE_TXID, coinbase.txid());
        assertEquals(1, coinbase.inputs().size());
        assertTrue(coinbase.inputs().get(0).isCoinbaseReference());
        assertEquals(0xFFFFFFFFL, coinbase.inputs().get(0).outputIndex());
        assertEquals(5_000_000_000L, coinbase.outputs().get(0).value());
    }

    private static Transaction.Builder sampleBuilder() {
        return Transaction.builder()
                .input(new TxInput(PREV, 0))
                .output(TxOutput.ofScriptHex(5000, SCRIPT));
    }

    private static String sequentialTxid() {
        byte[] b = new byte[32];
        for (int i = 0; i < 32; i++) b[i] = (byte) (i + 1);
        return Hex.encode(b);
    }

    private static byte[] slice(byte[] in, int from, int len) {
        byte[] out = new byte[len];
        System.arraycopy(in, from, out, 0, len);
        return out;
    }
}
