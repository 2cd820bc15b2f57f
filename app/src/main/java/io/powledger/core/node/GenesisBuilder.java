package io.powledger.core.node;

import io.powledger.core.consensus.ProofOfWork;
import io.powledger.core.consensus.SearchResult;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockHeader;
import io.powledger.core.protocol.ProtocolLimits;
import io.powledger.core.protocol.TxOutput;
import io.powledger.core.state.UtxoStore;
import io.powledger.core.storage.ChainStore;

import java.time.Clock;
import java.util.List;

/**
 * Creates the genesis block and seeds the initial unspent output.
 * - index = 0
 * - previousHash = "0"
 * - no transactions, so the Merkle root is 32 zero bytes
 * - mined at the configured difficulty like every other block
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static Block buildGenesis(ProofOfWork pow, NodeConfig config, Clock clock) {
        BlockHeader template = new BlockHeader(
                0L,
                BlockHeader.formatTimestamp(clock.instant()),
                ProtocolLimits.GENESIS_PREVIOUS_HASH,
                ProtocolLimits.EMPTY_MERKLE_ROOT,
                0L
        );
        SearchResult result = pow.search(template, config.difficulty, config.maxPowTries);
        if (!result.isFound()) {
            throw new IllegalStateException("Genesis search exhausted after " + result.attempts() + " attempts");
        }
        return new Block(result.header().get(), List.of(), result.hash());
    }

    /** Register the configured starting output, if any. */
    public static void seedOutputs(UtxoStore utxo, NodeConfig config) {
        if (config.genesisUtxoTxid == null || config.genesisUtxoTxid.isBlank()) return;
        utxo.registerOutputs(config.genesisUtxoTxid,
                List.of(TxOutput.ofScriptHex(config.genesisUtxoValueMinor, config.genesisUtxoScriptHex)));
    }

    /**
     * If the chain is empty, store a genesis block and seed the output set.
     * Idempotent: does nothing if a head already exists.
     */
    public static void initIfNeeded(ChainStore chain, UtxoStore utxo, ProofOfWork pow, NodeConfig config, Clock clock) {
        if (chain.getHead().isPresent()) return;
        chain.append(buildGenesis(pow, config, clock));
        seedOutputs(utxo, config);
    }
}
