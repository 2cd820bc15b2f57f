package io.powledger.core.node;

/** Simple config holder for a local ledger instance. Values are fixed once the node is built. */
public final class NodeConfig {
    public final int difficulty;          // leading zero hex characters
    public final long maxPowTries;        // <= 0: search until found
    public final long feeMinor;
    public final long subsidyMinor;
    public final long faucetValueMinor;
    public final long dustMarginMinor;
    public final int spendsPerBlock;
    public final Long randomSeed;         // null: unseeded
    public final String genesisUtxoTxid;
    public final long genesisUtxoValueMinor;
    public final String genesisUtxoScriptHex;

    public NodeConfig(int difficulty, long maxPowTries, long feeMinor, long subsidyMinor,
                      long faucetValueMinor, long dustMarginMinor, int spendsPerBlock, Long randomSeed,
                      String genesisUtxoTxid, long genesisUtxoValueMinor, String genesisUtxoScriptHex) {
        if (difficulty < 0 || difficulty > 64) {
            throw new IllegalArgumentException("difficulty must be within 0..64, got " + difficulty);
        }
        if (spendsPerBlock <= 0) {
            throw new IllegalArgumentException("spendsPerBlock must be > 0");
        }
        if (feeMinor < 0 || subsidyMinor < 0 || dustMarginMinor < 0) {
            throw new IllegalArgumentException("fee, subsidy and dust margin must be >= 0");
        }
        if (faucetValueMinor <= feeMinor + dustMarginMinor) {
            throw new IllegalArgumentException("faucet value must exceed fee + dust margin");
        }
        this.difficulty = difficulty;
        this.maxPowTries = maxPowTries;
        this.feeMinor = feeMinor;
        this.subsidyMinor = subsidyMinor;
        this.faucetValueMinor = faucetValueMinor;
        this.dustMarginMinor = dustMarginMinor;
        this.spendsPerBlock = spendsPerBlock;
        this.randomSeed = randomSeed;
        this.genesisUtxoTxid = genesisUtxoTxid;
        this.genesisUtxoValueMinor = genesisUtxoValueMinor;
        this.genesisUtxoScriptHex = genesisUtxoScriptHex;
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                3,                  // easy PoW for local mining
                0L,                 // unbounded nonce search
                10_000L,            // flat fee per spend
                5_000_000_000L,     // coinbase subsidy (50 coins)
                50_000_000L,        // faucet output value
                1_000L,             // minimum change left after payment + fee
                5,                  // spends per block
                null,
                "48437ddb190b006f858cdd881284ad467d68bfc4c74f3e6f621eb5af33be88d8",
                100_000_000L,       // seeded genesis output (1 coin)
                "76a9141d0f172a0ecb48aee1be1f2687d2963ae33f71a188ac"
        );
    }

    public NodeConfig withDifficulty(int difficulty) {
        return new NodeConfig(difficulty, maxPowTries, feeMinor, subsidyMinor, faucetValueMinor,
                dustMarginMinor, spendsPerBlock, randomSeed, genesisUtxoTxid, genesisUtxoValueMinor,
                genesisUtxoScriptHex);
    }

    public NodeConfig withMaxPowTries(long maxPowTries) {
        return new NodeConfig(difficulty, maxPowTries, feeMinor, subsidyMinor, faucetValueMinor,
                dustMarginMinor, spendsPerBlock, randomSeed, genesisUtxoTxid, genesisUtxoValueMinor,
                genesisUtxoScriptHex);
    }

    public NodeConfig withRandomSeed(Long randomSeed) {
        return new NodeConfig(difficulty, maxPowTries, feeMinor, subsidyMinor, faucetValueMinor,
                dustMarginMinor, spendsPerBlock, randomSeed, genesisUtxoTxid, genesisUtxoValueMinor,
                genesisUtxoScriptHex);
    }

    /** Smallest value an output must exceed to be picked as a spend input. */
    public long minSpendableValue() {
        return feeMinor + dustMarginMinor;
    }
}
