package io.powledger.core.storage;

import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockHeader;
import io.powledger.core.protocol.ProtocolLimits;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryChainStoreTest {

    @Test
    void appendAndRead() {
        ChainStore store = new InMemoryChainStore();
        assertTrue(store.getHead().isEmpty());
        assertEquals(0, store.size());

        Block genesis = block(0, "0");
        Block next = block(1, genesis.hash());
        store.append(genesis);
        store.append(next);

        assertEquals(2, store.size());
        assertSame(next, store.getHead().orElseThrow());
        assertSame(genesis, store.getBlock(0).orElseThrow());
        assertTrue(store.getBlock(2).isEmpty());
        assertTrue(store.getBlock(-1).isEmpty());
        assertEquals(List.of(genesis, next), store.getBlocksInOrder());
    }

    @Test
    void snapshotIsDetached() {
        ChainStore store = new InMemoryChainStore();
        store.append(block(0, "0"));
        List<Block> snapshot = store.getBlocksInOrder();
        store.append(block(1, "x"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(block(2, "y")));
    }

    @Test
    void nullBlockRejected() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryChainStore().append(null));
    }

    private static Block block(long index, String prev) {
        return Block.sealed(new BlockHeader(index, "2024-01-01T00:00:00.000Z", prev, ProtocolLimits.EMPTY_MERKLE_ROOT, 0), List.of());
    }
}
