package io.powledger.core.node;

import io.powledger.core.consensus.ChainVerdict;
import io.powledger.core.protocol.Block;

import java.util.List;

public record ChainSnapshot(List<Block> blocks, ChainVerdict verdict) {
    public ChainSnapshot {
        blocks = List.copyOf(blocks);
    }
}
