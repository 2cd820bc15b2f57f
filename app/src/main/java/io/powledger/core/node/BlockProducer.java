package io.powledger.core.node;

import io.powledger.core.consensus.ProofOfWork;
import io.powledger.core.consensus.SearchResult;
import io.powledger.core.metrics.BlockMetrics;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockHeader;
import io.powledger.core.protocol.Merkle;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.state.BlockRejectedException;
import io.powledger.core.state.UtxoStore;
import io.powledger.core.storage.ChainStore;
import io.powledger.core.workload.WorkloadGenerator;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Builds a block from a generated round of transactions, runs the nonce search,
 * applies the block to the output set, and appends it.
 */
public final class BlockProducer {
    private static final Logger LOG = Logger.getLogger(BlockProducer.class.getName());

    private final ChainStore chain;
    private final UtxoStore utxo;
    private final WorkloadGenerator generator;
    private final ProofOfWork pow;
    private final int difficulty;
    private final long maxTries;
    private final Clock clock;

    public BlockProducer(ChainStore chain, UtxoStore utxo, WorkloadGenerator generator, ProofOfWork pow,
                         int difficulty, long maxTries, Clock clock) {
        this.chain = chain;
        this.utxo = utxo;
        this.generator = generator;
        this.pow = pow;
        this.difficulty = difficulty;
        this.maxTries = maxTries;
        this.clock = clock;
    }

    /** One production round: returns the appended block, or empty if the search was exhausted. */
    public Optional<Block> produce() {
        List<Transaction> txs = generator.nextRound(utxo);
        return produce(txs);
    }

    /**
     * Mine and append a block carrying exactly {@code txs}.
     *
     * @throws BlockRejectedException if the transactions conflict with the output set;
     *                                neither the chain nor the set is changed
     */
    public Optional<Block> produce(List<Transaction> txs) {
        Block parent = chain.getHead()
                .orElseThrow(() -> new IllegalStateException("Chain has no genesis block"));

        BlockHeader template = new BlockHeader(
                parent.index() + 1,
                BlockHeader.formatTimestamp(clock.instant()),
                parent.hash(),
                Merkle.rootOfTransactions(txs),
                0L
        );

        SearchResult result = pow.search(template, difficulty, maxTries);
        BlockMetrics.recordSearchAttempts(result.attempts());
        if (!result.isFound()) {
            LOG.warning("Nonce search for block " + template.index() + " exhausted after " + result.attempts() + " attempts");
            return Optional.empty();
        }
        Block block = new Block(result.header().get(), txs, result.hash());

        try {
            utxo.applyBlock(block);
        } catch (BlockRejectedException e) {
            BlockMetrics.recordRejectedBlock();
            throw e;
        }
        chain.append(block);
        BlockMetrics.incrementBlocks();
        LOG.info("Mined block " + block.index() + " nonce=" + block.nonce() + " hash=" + block.hash()
                + " after " + result.attempts() + " attempts");
        return Optional.of(block);
    }
}
