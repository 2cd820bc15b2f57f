package io.powledger.core.state;

import io.powledger.core.metrics.BlockMetrics;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TxInput;
import io.powledger.core.protocol.TxOutput;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * In-memory implementation of UtxoStore.
 * Entries are grouped per owning txid in registration order.
 * Not persistent; resets every process run.
 */
public final class InMemoryUtxoStore implements UtxoStore {
    private static final Logger LOG = Logger.getLogger(InMemoryUtxoStore.class.getName());

    private final Map<String, List<UtxoEntry>> pool = new LinkedHashMap<>();

    @Override
    public synchronized void registerOutputs(String txId, List<TxOutput> outputs) {
        List<UtxoEntry> entries = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++) {
            TxOutput o = outputs.get(i);
            entries.add(new UtxoEntry(txId, i, o.value(), o.scriptHex(), false));
        }
        pool.put(txId, entries);
    }

    @Override
    public synchronized boolean spend(String txId, long outputIndex) {
        List<UtxoEntry> entries = pool.get(txId);
        int pos = positionOf(entries, outputIndex);
        if (pos < 0 || entries.get(pos).spent()) {
            LOG.fine("Spend ignored for " + txId + ":" + outputIndex + " (missing or already spent)");
            BlockMetrics.recordRejectedSpend();
            return false;
        }
        entries.set(pos, entries.get(pos).asSpent());
        return true;
    }

    @Override
    public synchronized List<UtxoEntry> listAvailable() {
        List<UtxoEntry> out = new ArrayList<>();
        for (List<UtxoEntry> entries : pool.values()) {
            for (UtxoEntry e : entries) {
                if (!e.spent()) out.add(e);
            }
        }
        return out;
    }

    @Override
    public synchronized Optional<UtxoEntry> find(String txId, long outputIndex) {
        List<UtxoEntry> entries = pool.get(txId);
        int pos = positionOf(entries, outputIndex);
        return pos < 0 ? Optional.empty() : Optional.of(entries.get(pos));
    }

    @Override
    public synchronized long size() {
        long n = 0;
        for (List<UtxoEntry> entries : pool.values()) n += entries.size();
        return n;
    }

    @Override
    public synchronized void applyBlock(Block block) {
        // phase 1: every input must resolve to a distinct unspent entry of the current set
        Set<Outpoint> claimed = new HashSet<>();
        for (Transaction tx : block.transactions()) {
            for (TxInput in : tx.inputs()) {
                if (in.isCoinbaseReference()) continue;
                Outpoint op = new Outpoint(in.previousTxId(), in.outputIndex());
                Optional<UtxoEntry> entry = find(op.txId(), op.outputIndex());
                if (entry.isEmpty()) {
                    throw new BlockRejectedException("Block " + block.index() + " spends unknown output " + op, op);
                }
                if (entry.get().spent()) {
                    throw new BlockRejectedException("Block " + block.index() + " spends already spent output " + op, op);
                }
                if (!claimed.add(op)) {
                    throw new BlockRejectedException("Block " + block.index() + " spends " + op + " twice", op);
                }
            }
        }

        // phase 2: commit
        for (Transaction tx : block.transactions()) {
            for (TxInput in : tx.inputs()) {
                if (in.isCoinbaseReference()) continue;
                spend(in.previousTxId(), in.outputIndex());
            }
            registerOutputs(tx.txid(), tx.outputs());
        }
    }

    private static int positionOf(List<UtxoEntry> entries, long outputIndex) {
        if (entries == null) return -1;
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).outputIndex() == outputIndex) return i;
        }
        return -1;
    }
}
