package io.powledger.core.node;

import io.powledger.core.chainio.ChainExporter;
import io.powledger.core.chainio.ChainFormat;
import io.powledger.core.chainio.ChainImporter;
import io.powledger.core.chainio.ImportedChain;
import io.powledger.core.chainio.RawBlockRecord;
import io.powledger.core.consensus.ChainRecord;
import io.powledger.core.consensus.ChainValidator;
import io.powledger.core.consensus.ChainVerdict;
import io.powledger.core.consensus.ProofOfWork;
import io.powledger.core.metrics.BlockMetrics;
import io.powledger.core.protocol.Block;
import io.powledger.core.state.InMemoryUtxoStore;
import io.powledger.core.state.UtxoStore;
import io.powledger.core.storage.ChainStore;
import io.powledger.core.storage.InMemoryChainStore;
import io.powledger.core.workload.WorkloadGenerator;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * One ledger instance: chain, unspent set, generator and producer wired together.
 * Start once, then call {@link #mine()} to append blocks.
 * <p>
 * Operations are serialized on this instance. A mining round holds the lock for the
 * whole nonce search, so other callers wait until it completes.
 */
public final class Node {

    private final ChainStore chain;
    private final UtxoStore utxo;
    private final ProofOfWork pow;
    private final BlockProducer producer;
    private final NodeConfig config;
    private final Clock clock;

    public Node(ChainStore chain, UtxoStore utxo, ProofOfWork pow, NodeConfig config, Random random, Clock clock) {
        this.chain = chain;
        this.utxo = utxo;
        this.pow = pow;
        this.config = config;
        this.clock = clock;
        WorkloadGenerator generator = new WorkloadGenerator(config, random);
        this.producer = new BlockProducer(chain, utxo, generator, pow, config.difficulty, config.maxPowTries, clock);
    }

    /** Convenience factory for an in-memory node. */
    public static Node inMemory(NodeConfig config) {
        return inMemory(config, Clock.systemUTC());
    }

    public static Node inMemory(NodeConfig config, Clock clock) {
        Random random = config.randomSeed != null ? new Random(config.randomSeed) : new SecureRandom();
        return new Node(new InMemoryChainStore(), new InMemoryUtxoStore(), new ProofOfWork(), config, random, clock);
    }

    /** Ensure genesis exists and the starting output is seeded. Safe to call multiple times. */
    public synchronized void start() {
        GenesisBuilder.initIfNeeded(chain, utxo, pow, config, clock);
    }

    /** One mining round; empty when the nonce search hit its attempt cap. */
    public synchronized Optional<MineResult> mine() {
        Optional<Block> block = BlockMetrics.recordMining(producer::produce);
        return block.map(b -> new MineResult(b, validate()));
    }

    public synchronized ChainSnapshot query() {
        List<Block> blocks = chain.getBlocksInOrder();
        return new ChainSnapshot(blocks, ChainValidator.validateBlocks(blocks, config.difficulty));
    }

    public synchronized ChainVerdict validate() {
        return ChainValidator.validateBlocks(chain.getBlocksInOrder(), config.difficulty);
    }

    public synchronized String export(ChainFormat format) {
        return ChainExporter.export(chain.getBlocksInOrder(), format);
    }

    /**
     * Validate chain file content against this node's difficulty.
     *
     * @throws io.powledger.core.chainio.MalformedChainException if no format matches
     */
    public ImportedChain validateImported(String content) {
        return verdictFor(ChainImporter.parse(content));
    }

    public ImportedChain validateImportedFile(Path file) {
        return verdictFor(ChainImporter.parseFile(file));
    }

    private ImportedChain verdictFor(List<RawBlockRecord> raw) {
        List<ChainRecord> records = ChainImporter.normalize(raw);
        return new ImportedChain(config.difficulty, records, ChainValidator.validate(records, config.difficulty));
    }

    public ChainStore chain() { return chain; }
    public UtxoStore utxo() { return utxo; }
    public NodeConfig config() { return config; }
}
