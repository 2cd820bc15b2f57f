package io.powledger.core.workload;

import io.powledger.core.node.NodeConfig;
import io.powledger.core.protocol.Hex;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TxInput;
import io.powledger.core.protocol.TxOutput;
import io.powledger.core.state.UtxoEntry;
import io.powledger.core.state.UtxoStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Produces demonstration traffic: one coinbase followed by a fixed number of
 * single-input, two-output spends drawn from the unspent set.
 * <p>
 * Each spend pays a random amount in {@code [1, value - fee - dustMargin]} and
 * returns the rest minus the flat fee as change, so
 * {@code payment + change + fee == input value}. Inputs are drawn without
 * replacement; outputs too small to cover fee and margin are never picked.
 */
public final class WorkloadGenerator {
    private static final Logger LOG = Logger.getLogger(WorkloadGenerator.class.getName());

    private static final String[] NOTES = {
            "Alice pays Bob (shopping)",
            "Charlie pays Dave (peer payment)",
            "Eve buys coffee",
            "Donation to charity",
            "Micro tip to content creator"
    };

    private final NodeConfig config;
    private final Random random;

    public WorkloadGenerator(NodeConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    /**
     * Coinbase first, then {@code config.spendsPerBlock} spends. Injects faucet
     * outputs into {@code utxo} when there are not enough spendable entries.
     */
    public List<Transaction> nextRound(UtxoStore utxo) {
        List<Transaction> txs = new ArrayList<>(config.spendsPerBlock + 1);
        txs.add(Transaction.coinbase(config.subsidyMinor, randomP2pkhScript()));

        List<UtxoEntry> chosen = pickInputs(utxo);
        for (int i = 0; i < chosen.size(); i++) {
            txs.add(spend(chosen.get(i), NOTES[i % NOTES.length]));
        }
        return txs;
    }

    List<UtxoEntry> pickInputs(UtxoStore utxo) {
        List<UtxoEntry> candidates = spendable(utxo);
        int missing = config.spendsPerBlock - candidates.size();
        if (missing > 0) {
            injectFaucet(utxo, missing);
            candidates = spendable(utxo);
        }
        List<UtxoEntry> chosen = new ArrayList<>(config.spendsPerBlock);
        while (chosen.size() < config.spendsPerBlock && !candidates.isEmpty()) {
            chosen.add(candidates.remove(random.nextInt(candidates.size())));
        }
        return chosen;
    }

    private List<UtxoEntry> spendable(UtxoStore utxo) {
        List<UtxoEntry> out = new ArrayList<>();
        for (UtxoEntry e : utxo.listAvailable()) {
            if (e.value() > config.minSpendableValue()) out.add(e);
        }
        return out;
    }

    private void injectFaucet(UtxoStore utxo, int count) {
        String faucetTxid = Hex.encode(randomBytes(32));
        List<TxOutput> outputs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            outputs.add(new TxOutput(config.faucetValueMinor, randomP2pkhScript()));
        }
        utxo.registerOutputs(faucetTxid, outputs);
        LOG.info("Faucet " + faucetTxid.substring(0, 8) + "… injected " + count + " output(s) of " + config.faucetValueMinor);
    }

    private Transaction spend(UtxoEntry input, String note) {
        long fee = config.feeMinor;
        long maxSend = input.value() - fee - config.dustMarginMinor;
        long payment = 1 + random.nextLong(maxSend);
        long change = input.value() - payment - fee;
        return Transaction.builder()
                .input(new TxInput(input.owningTxId(), input.outputIndex()))
                .output(new TxOutput(payment, randomP2pkhScript()))
                .output(new TxOutput(change, randomP2pkhScript()))
                .note(note)
                .fee(fee)
                .build();
    }

    /** OP_DUP OP_HASH160 &lt;20 bytes&gt; OP_EQUALVERIFY OP_CHECKSIG, with a random hash. */
    public byte[] randomP2pkhScript() {
        return p2pkhScript(randomBytes(20));
    }

    public static byte[] p2pkhScript(byte[] pubKeyHash20) {
        if (pubKeyHash20.length != 20) throw new IllegalArgumentException("pubkey hash must be 20 bytes");
        return Hex.decode("76a914" + Hex.encode(pubKeyHash20) + "88ac");
    }

    private byte[] randomBytes(int n) {
        byte[] b = new byte[n];
        random.nextBytes(b);
        return b;
    }
}
