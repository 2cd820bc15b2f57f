package io.powledger.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int TX_VERSION = 1;
    public static final long TX_LOCKTIME = 0L;

    /** Counts and script lengths are written as a single byte. */
    public static final int MAX_INPUTS = 255;
    public static final int MAX_OUTPUTS = 255;
    public static final int MAX_SCRIPT_BYTES = 255;

    public static final int TXID_HEX_LENGTH = 64;
    public static final long MAX_UINT32 = 0xFFFFFFFFL;
    public static final long DEFAULT_SEQUENCE = 0xFFFFFFFFL;

    /**
     * Coinbase input reference and forced coinbase txid. Kept exactly as the
     * chain files carry it.
     */
    public static final String COINBASE_TXID = "0000000000000000000000000000000000000000000000000000000000000000";
    public static final long COINBASE_OUTPUT_INDEX = 0xFFFFFFFFL;

    public static final String GENESIS_PREVIOUS_HASH = "0";
    public static final String EMPTY_MERKLE_ROOT = "0".repeat(64);
}
