package io.powledger.core.consensus;

import java.util.List;

public record ChainVerdict(boolean overallValid, List<Long> invalidIndices, List<BlockCheck> perBlock) {

    public ChainVerdict {
        invalidIndices = List.copyOf(invalidIndices);
        perBlock = List.copyOf(perBlock);
    }

    public BlockCheck check(int position) {
        return perBlock.get(position);
    }
}
