package io.powledger.core.chainio;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.powledger.core.consensus.BlockCheck;
import io.powledger.core.consensus.ChainRecord;
import io.powledger.core.consensus.ChainVerdict;
import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.Transaction;
import io.powledger.core.protocol.TxInput;
import io.powledger.core.protocol.TxOutput;
import org.yaml.snakeyaml.LoaderOptions;

import java.util.List;

/**
 * Jackson tree rendering of blocks, transactions and verdicts. Shared by the
 * exporters and the HTTP API so both emit the same field names.
 */
public final class ChainJson {
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Upper bound on code points in a YAML chain document read back in. */
    public static final int YAML_CODE_POINT_LIMIT = 256 * 1024 * 1024;

    public static final YAMLMapper YAML = new YAMLMapper(YAMLFactory.builder()
            .loaderOptions(yamlLoaderOptions())
            .build());

    private ChainJson() {}

    private static LoaderOptions yamlLoaderOptions() {
        LoaderOptions options = new LoaderOptions();
        options.setCodePointLimit(YAML_CODE_POINT_LIMIT);
        return options;
    }

    public static ObjectNode chainDocument(List<Block> blocks) {
        ObjectNode root = MAPPER.createObjectNode();
        root.set("chain", blocks(blocks));
        return root;
    }

    public static ArrayNode blocks(List<Block> blocks) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Block b : blocks) array.add(block(b));
        return array;
    }

    public static ObjectNode block(Block b) {
        ObjectNode node = MAPPER.createObjectNode()
                .put("index", b.index())
                .put("timestamp", b.timestamp())
                .put("previousHash", b.previousHash())
                .put("merkleRoot", b.merkleRoot())
                .put("hash", b.hash())
                .put("nonce", b.nonce());
        node.set("transactions", transactions(b.transactions()));
        return node;
    }

    public static ArrayNode transactions(List<Transaction> txs) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Transaction tx : txs) array.add(transaction(tx));
        return array;
    }

    public static ObjectNode transaction(Transaction tx) {
        ObjectNode node = MAPPER.createObjectNode()
                .put("txid", tx.txid())
                .put("version", tx.version());
        ArrayNode inputs = node.putArray("inputs");
        for (TxInput in : tx.inputs()) {
            inputs.addObject()
                    .put("previousTxId", in.previousTxId())
                    .put("outputIndex", in.outputIndex())
                    .put("sequence", in.sequence());
        }
        ArrayNode outputs = node.putArray("outputs");
        for (TxOutput out : tx.outputs()) {
            outputs.addObject()
                    .put("value", out.value())
                    .put("script", out.scriptHex());
        }
        node.put("locktime", tx.locktime());
        if (tx.note() != null) node.put("note", tx.note());
        node.put("fee", tx.fee());
        node.put("coinbase", tx.isCoinbase());
        return node;
    }

    public static ArrayNode records(List<ChainRecord> records) {
        ArrayNode array = MAPPER.createArrayNode();
        for (ChainRecord r : records) {
            array.addObject()
                    .put("index", r.index())
                    .put("timestamp", r.timestamp())
                    .put("previousHash", r.previousHash())
                    .put("merkleRoot", r.merkleRoot())
                    .put("hash", r.hash())
                    .put("nonce", r.nonce());
        }
        return array;
    }

    public static ObjectNode verdict(ChainVerdict verdict) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("overallValid", verdict.overallValid());
        ArrayNode invalid = node.putArray("invalidIndices");
        for (Long idx : verdict.invalidIndices()) invalid.add(idx);
        ArrayNode per = node.putArray("perBlock");
        for (BlockCheck c : verdict.perBlock()) {
            per.addObject()
                    .put("index", c.index())
                    .put("hashValid", c.hashValid())
                    .put("powValid", c.powValid())
                    .put("indexValid", c.indexValid())
                    .put("prevHashValid", c.prevHashValid())
                    .put("blockValid", c.blockValid())
                    .put("cascaded", c.cascaded());
        }
        return node;
    }
}
