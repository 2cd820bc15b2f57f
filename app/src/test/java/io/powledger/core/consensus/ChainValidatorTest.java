package io.powledger.core.consensus;

import io.powledger.core.node.Node;
import io.powledger.core.node.NodeConfig;
import io.powledger.core.protocol.Block;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChainValidatorTest {

    private List<Block> blocks;

    @BeforeEach
    void mineChain() {
        Node node = Node.inMemory(NodeConfig.defaultLocal().withDifficulty(1).withRandomSeed(7L));
        node.start();
        for (int i = 0; i < 3; i++) node.mine().orElseThrow();
        blocks = node.chain().getBlocksInOrder();
    }

    @Test
    void minedChainIsValid() {
        ChainVerdict verdict = ChainValidator.validateBlocks(blocks, 1);

        assertTrue(verdict.overallValid());
        assertTrue(verdict.invalidIndices().isEmpty());
        assertEquals(4, verdict.perBlock().size());
        for (BlockCheck c : verdict.perBlock()) {
            assertTrue(c.blockValid());
            assertFalse(c.cascaded());
        }
    }

    @Test
    void tamperedNonceInvalidatesBlockAndEverythingAfter() {
        List<Block> tampered = new ArrayList<>(blocks);
        tampered.set(2, blocks.get(2).withNonce(blocks.get(2).nonce() + 1));

        ChainVerdict verdict = ChainValidator.validateBlocks(tampered, 1);

        assertFalse(verdict.overallValid());
        assertEquals(List.of(2L, 3L), verdict.invalidIndices());
        assertTrue(verdict.check(0).blockValid());
        assertTrue(verdict.check(1).blockValid());

        BlockCheck broken = verdict.check(2);
        assertFalse(broken.hashValid());
        assertFalse(broken.blockValid());
        assertFalse(broken.cascaded());

        BlockCheck after = verdict.check(3);
        assertTrue(after.hashValid());
        assertTrue(after.powValid());
        assertTrue(after.indexValid());
        assertTrue(after.prevHashValid(), "link is checked against the stored hash");
        assertTrue(after.cascaded());
        assertFalse(after.blockValid());
    }

    @Test
    void genesisMustLinkToZero() {
        List<ChainRecord> records = records();
        ChainRecord g = records.get(0);
        records.set(0, new ChainRecord(g.index(), g.timestamp(), "1", g.merkleRoot(), g.hash(), g.nonce()));

        ChainVerdict verdict = ChainValidator.validate(records, 1);

        assertFalse(verdict.check(0).prevHashValid());
        assertEquals(List.of(0L, 1L, 2L, 3L), verdict.invalidIndices());
    }

    @Test
    void indexGapIsReported() {
        List<Block> gapped = new ArrayList<>(blocks);
        gapped.remove(1);

        ChainVerdict verdict = ChainValidator.validateBlocks(gapped, 1);

        BlockCheck c = verdict.check(1);
        assertEquals(2L, c.index());
        assertFalse(c.indexValid());
        assertFalse(c.prevHashValid());
        assertFalse(verdict.overallValid());
    }

    @Test
    void higherDifficultyFailsProofOfWork() {
        ChainVerdict verdict = ChainValidator.validateBlocks(blocks, 64);

        assertFalse(verdict.overallValid());
        assertFalse(verdict.check(0).powValid());
        assertTrue(verdict.check(0).hashValid());
    }

    @Test
    void emptyChainIsValid() {
        ChainVerdict verdict = ChainValidator.validate(List.of(), 3);
        assertTrue(verdict.overallValid());
        assertTrue(verdict.perBlock().isEmpty());
    }

    @Test
    void nullAndEmptyRecordsDoNotThrow() {
        List<ChainRecord> records = Arrays.asList(null, new ChainRecord(1L, null, null, null, null, 0L));

        ChainVerdict verdict = assertDoesNotThrow(() -> ChainValidator.validate(records, 1));

        assertFalse(verdict.overallValid());
        assertEquals(2, verdict.perBlock().size());
        assertFalse(verdict.check(0).hashValid());
    }

    private List<ChainRecord> records() {
        List<ChainRecord> out = new ArrayList<>();
        for (Block b : blocks) out.add(ChainRecord.of(b));
        return out;
    }
}
