package io.powledger.core.node;

import io.powledger.core.consensus.ChainVerdict;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.Transaction;

import java.util.List;

/** A freshly appended block, its transactions (coinbase first), and the refreshed verdict. */
public record MineResult(Block block, ChainVerdict verdict) {
    public List<Transaction> transactions() {
        return block.transactions();
    }
}
