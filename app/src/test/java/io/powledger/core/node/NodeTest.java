package io.powledger.core.node;

import io.powledger.core.consensus.ChainVerdict;
import io.powledger.core.consensus.ProofOfWork;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.ProtocolLimits;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TxInput;
import io.powledger.core.protocol.TxOutput;
import io.powledger.core.state.BlockRejectedException;
import io.powledger.core.state.InMemoryUtxoStore;
import io.powledger.core.state.UtxoStore;
import io.powledger.core.storage.ChainStore;
import io.powledger.core.storage.InMemoryChainStore;
import io.powledger.core.workload.WorkloadGenerator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00.123Z"), ZoneOffset.UTC);

    private final NodeConfig config = NodeConfig.defaultLocal().withDifficulty(2).withRandomSeed(42L);

    @Test
    void startCreatesMinedGenesisOnce() {
        Node node = Node.inMemory(config, CLOCK);
        node.start();
        node.start();

        assertEquals(1, node.chain().size());
        Block genesis = node.chain().getHead().orElseThrow();
        assertEquals(0, genesis.index());
        assertEquals(ProtocolLimits.GENESIS_PREVIOUS_HASH, genesis.previousHash());
        assertEquals(ProtocolLimits.EMPTY_MERKLE_ROOT, genesis.merkleRoot());
        assertTrue(genesis.transactions().isEmpty());
        assertEquals("2024-05-01T12:00:00.123Z", genesis.timestamp());
        assertTrue(genesis.hash().startsWith("00"));
        assertEquals(genesis.header().hash(), genesis.hash());

        assertEquals(1, node.utxo().size(), "seed output registered once");
        assertTrue(node.utxo().find(config.genesisUtxoTxid, 0).isPresent());
    }

    @Test
    void miningAppendsLinkedValidBlocks() {
        Node node = Node.inMemory(config, CLOCK);
        node.start();

        for (int i = 1; i <= 3; i++) {
            MineResult result = node.mine().orElseThrow();
            assertEquals(i, result.block().index());
            assertEquals(6, result.transactions().size());
            assertTrue(result.verdict().overallValid());
        }

        List<Block> blocks = node.query().blocks();
        assertEquals(4, blocks.size());
        for (int i = 1; i < blocks.size(); i++) {
            Block b = blocks.get(i);
            assertEquals(blocks.get(i - 1).hash(), b.previousHash());
            assertEquals(b.computeMerkleRoot(), b.merkleRoot());
            assertTrue(b.transactions().get(0).isCoinbase());
        }
        assertTrue(node.query().verdict().overallValid());
    }

    @Test
    void spentInputsLeaveAvailableSet() {
        Node node = Node.inMemory(config, CLOCK);
        node.start();

        Block block = node.mine().orElseThrow().block();

        for (Transaction tx : block.transactions().subList(1, 6)) {
            TxInput in = tx.inputs().get(0);
            assertTrue(node.utxo().find(in.previousTxId(), in.outputIndex()).orElseThrow().spent());
            assertEquals(2, node.utxo().listAvailable().stream()
                    .filter(e -> e.owningTxId().equals(tx.txid())).count());
        }
    }

    @Test
    void exhaustedSearchLeavesChainUntouched() {
        ChainStore chain = new InMemoryChainStore();
        UtxoStore utxo = new InMemoryUtxoStore();
        ProofOfWork pow = new ProofOfWork();
        GenesisBuilder.initIfNeeded(chain, utxo, pow, config, CLOCK);

        BlockProducer producer = new BlockProducer(chain, utxo,
                new WorkloadGenerator(config, new Random(1)), pow, 64, 10, CLOCK);

        Optional<Block> block = producer.produce();

        assertTrue(block.isEmpty());
        assertEquals(1, chain.size());
        assertTrue(utxo.find(config.genesisUtxoTxid, 0).isPresent());
        assertFalse(utxo.find(config.genesisUtxoTxid, 0).get().spent());
    }

    @Test
    void conflictingTransactionsAreRejected() {
        ChainStore chain = new InMemoryChainStore();
        UtxoStore utxo = new InMemoryUtxoStore();
        ProofOfWork pow = new ProofOfWork();
        GenesisBuilder.initIfNeeded(chain, utxo, pow, config, CLOCK);
        BlockProducer producer = new BlockProducer(chain, utxo,
                new WorkloadGenerator(config, new Random(1)), pow, 1, 0, CLOCK);

        TxInput seed = new TxInput(config.genesisUtxoTxid, 0);
        List<Transaction> txs = List.of(
                Transaction.coinbase(config.subsidyMinor, new byte[] {1}),
                Transaction.builder().input(seed).output(new TxOutput(1_000, new byte[] {2})).build(),
                Transaction.builder().input(seed).output(new TxOutput(2_000, new byte[] {3})).build());

        assertThrows(BlockRejectedException.class, () -> producer.produce(txs));
        assertEquals(1, chain.size());
        assertFalse(utxo.find(config.genesisUtxoTxid, 0).orElseThrow().spent());
    }

    @Test
    void configRejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> config.withDifficulty(65));
        assertThrows(IllegalArgumentException.class, () -> config.withDifficulty(-1));
        assertEquals(11_000, NodeConfig.defaultLocal().minSpendableValue());
    }

    @Test
    void validateMatchesQueryVerdict() {
        Node node = Node.inMemory(config, CLOCK);
        node.start();
        node.mine();

        ChainVerdict verdict = node.validate();
        assertEquals(node.query().verdict(), verdict);
    }
}
