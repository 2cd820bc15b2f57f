package io.powledger.core.chainio;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Accepted names for each block field in imported files, in resolution order.
 * Every name is tried exactly first, then ignoring case, before moving to the next.
 */
public enum FieldAlias {
    INDEX("index", "idx"),
    TIMESTAMP("timestamp", "ts"),
    PREVIOUS_HASH("previousHash", "prevHash", "previous_hash", "previous hash"),
    MERKLE_ROOT("merkleRoot", "merkle_root", "merkle root"),
    HASH("hash"),
    NONCE("nonce"),
    TRANSACTIONS("transactions", "data");

    private final List<String> names;

    FieldAlias(String... names) {
        this.names = List.of(names);
    }

    /** First non-null value under any of this field's names. */
    public Optional<JsonNode> resolve(JsonNode fields) {
        if (fields == null || !fields.isObject()) return Optional.empty();
        for (String name : names) {
            JsonNode exact = fields.get(name);
            if (exact != null && !exact.isNull()) return Optional.of(exact);
            Iterator<String> it = fields.fieldNames();
            while (it.hasNext()) {
                String key = it.next();
                if (key.equalsIgnoreCase(name)) {
                    JsonNode v = fields.get(key);
                    if (v != null && !v.isNull()) return Optional.of(v);
                }
            }
        }
        return Optional.empty();
    }
}
