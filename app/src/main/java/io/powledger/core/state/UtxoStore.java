package io.powledger.core.state;

import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.TxOutput;

import java.util.List;
import java.util.Optional;

/**
 * Unspent output bookkeeping. The set only grows: spent entries are kept and flagged.
 */
public interface UtxoStore {

    /**
     * Register all outputs of {@code txId} as unspent, indexed by position.
     * Replaces any entries already registered under the same id.
     */
    void registerOutputs(String txId, List<TxOutput> outputs);

    /** Mark an entry spent. False when it is unknown or already spent; never throws. */
    boolean spend(String txId, long outputIndex);

    /** Snapshot of unspent entries, in registration order then output index. */
    List<UtxoEntry> listAvailable();

    Optional<UtxoEntry> find(String txId, long outputIndex);

    /** Total entries ever registered, spent ones included. */
    long size();

    /**
     * Apply a whole block: every input is checked against the current set first,
     * then all spends and registrations are committed together.
     *
     * @throws BlockRejectedException if any input is missing, spent, or claimed twice
     */
    void applyBlock(Block block);
}
