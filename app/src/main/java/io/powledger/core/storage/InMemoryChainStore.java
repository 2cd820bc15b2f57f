package io.powledger.core.storage;

import io.powledger.core.protocol.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Simple in-memory chain store backed by a list.
 * Good for tests and local demo nodes; nothing survives a restart.
 */
public final class InMemoryChainStore implements ChainStore {

    private final List<Block> blocks = new ArrayList<>();

    @Override
    public synchronized void append(Block block) {
        if (block == null) throw new IllegalArgumentException("block must not be null");
        blocks.add(block);
    }

    @Override
    public synchronized Optional<Block> getBlock(long position) {
        if (position < 0 || position >= blocks.size()) return Optional.empty();
        return Optional.of(blocks.get((int) position));
    }

    @Override
    public synchronized Optional<Block> getHead() {
        return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks.get(blocks.size() - 1));
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }

    @Override
    public synchronized List<Block> getBlocksInOrder() {
        return List.copyOf(blocks);
    }
}
