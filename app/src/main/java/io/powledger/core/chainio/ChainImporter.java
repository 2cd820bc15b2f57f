package io.powledger.core.chainio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.powledger.core.consensus.ChainRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads chain files in any of the exported formats.
 * <ol>
 *   <li>Content starting with '{' or '[' is JSON: a root array, or an object with a "chain" array.</li>
 *   <li>Otherwise YAML with the same two shapes.</li>
 *   <li>Otherwise the text layout: sections split on "---" lines, "Label: value" lines,
 *       labels matched ignoring case. Sections without an index or nonce are skipped.</li>
 * </ol>
 */
public final class ChainImporter {
    private static final Logger LOG = Logger.getLogger(ChainImporter.class.getName());

    private ChainImporter() {}

    public static List<RawBlockRecord> parseFile(Path path) {
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new MalformedChainException("Failed to read chain file " + path, e);
        }
    }

    public static List<RawBlockRecord> parse(String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedChainException("Chain file is empty");
        }
        String trimmed = content.strip();

        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            JsonNode root;
            try {
                root = ChainJson.MAPPER.readTree(trimmed);
            } catch (JsonProcessingException e) {
                throw new MalformedChainException("Invalid JSON chain file", e);
            }
            JsonNode chain = chainArray(root);
            if (chain != null) return records(chain);
        }

        try {
            JsonNode chain = chainArray(ChainJson.YAML.readTree(content));
            if (chain != null) return records(chain);
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.FINE, "Content is not YAML, trying text layout", e);
        }

        List<RawBlockRecord> blocks = parseText(content);
        if (!blocks.isEmpty()) return blocks;
        throw new MalformedChainException("Unsupported or malformed blockchain file");
    }

    public static List<ChainRecord> normalize(List<RawBlockRecord> raw) {
        List<ChainRecord> out = new ArrayList<>(raw.size());
        for (RawBlockRecord r : raw) out.add(r.toChainRecord());
        return out;
    }

    static List<RawBlockRecord> parseText(String content) {
        List<RawBlockRecord> out = new ArrayList<>();
        List<String> section = new ArrayList<>();
        for (String line : content.split("\\r?\\n", -1)) {
            if (line.strip().equals("---")) {
                addSection(section, out);
                section.clear();
            } else {
                section.add(line);
            }
        }
        addSection(section, out);
        return out;
    }

    private static void addSection(List<String> lines, List<RawBlockRecord> out) {
        ObjectNode fields = ChainJson.MAPPER.createObjectNode();
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            String label = line.substring(0, colon).strip();
            if (label.isEmpty() || fields.has(label)) continue;
            fields.set(label, valueNode(line.substring(colon + 1).strip()));
        }
        RawBlockRecord record = new RawBlockRecord(fields);
        if (record.has(FieldAlias.INDEX) && record.has(FieldAlias.NONCE)) {
            out.add(record);
        }
    }

    /** Values that look like JSON (the Transactions line) are kept structured. */
    private static JsonNode valueNode(String value) {
        if (value.startsWith("[") || value.startsWith("{")) {
            try {
                return ChainJson.MAPPER.readTree(value);
            } catch (JsonProcessingException e) {
                LOG.log(Level.FINE, "Keeping unparsable structured value as text", e);
            }
        }
        return TextNode.valueOf(value);
    }

    private static JsonNode chainArray(JsonNode root) {
        if (root == null) return null;
        if (root.isArray()) return root;
        if (root.isObject() && root.path("chain").isArray()) return root.get("chain");
        return null;
    }

    private static List<RawBlockRecord> records(JsonNode chain) {
        List<RawBlockRecord> out = new ArrayList<>(chain.size());
        for (JsonNode n : chain) out.add(new RawBlockRecord(n));
        return out;
    }
}
