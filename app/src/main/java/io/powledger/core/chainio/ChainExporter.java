package io.powledger.core.chainio;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.powledger.core.protocol.Block;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a block sequence as JSON, YAML, or the line-oriented text layout:
 * <pre>
 * ---
 * Index: 1
 * Timestamp: 2024-01-01T00:00:00.000Z
 * Previous Hash: ...
 * Hash: ...
 * MerkleRoot: ...
 * Transactions: [...compact JSON...]
 * Nonce: 42
 * </pre>
 * {@link ChainImporter} reads all three back.
 */
public final class ChainExporter {

    private ChainExporter() {}

    public static String export(List<Block> blocks, ChainFormat format) {
        switch (format) {
            case YAML:
                return toYaml(blocks);
            case TXT:
                return toText(blocks);
            case JSON:
            default:
                return toJson(blocks);
        }
    }

    public static String toJson(List<Block> blocks) {
        try {
            return ChainJson.MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(ChainJson.chainDocument(blocks));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render chain as JSON", e);
        }
    }

    public static String toYaml(List<Block> blocks) {
        try {
            return ChainJson.YAML.writeValueAsString(ChainJson.chainDocument(blocks));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render chain as YAML", e);
        }
    }

    public static String toText(List<Block> blocks) {
        List<String> lines = new ArrayList<>(blocks.size() * 8);
        for (Block b : blocks) {
            lines.add("---");
            lines.add("Index: " + b.index());
            lines.add("Timestamp: " + b.timestamp());
            lines.add("Previous Hash: " + b.previousHash());
            lines.add("Hash: " + b.hash());
            lines.add("MerkleRoot: " + b.merkleRoot());
            lines.add("Transactions: " + compactTransactions(b));
            lines.add("Nonce: " + b.nonce());
        }
        return String.join("\n", lines);
    }

    private static String compactTransactions(Block b) {
        try {
            return ChainJson.MAPPER.writeValueAsString(ChainJson.transactions(b.transactions()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render transactions of block " + b.index(), e);
        }
    }
}
