package io.powledger.core.chainio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.powledger.core.consensus.ChainRecord;

import java.util.Optional;

/**
 * A block as found in an imported file: every field optional, names unresolved.
 * {@link #toChainRecord()} applies the {@link FieldAlias} lists and defaults
 * anything absent or mistyped to {@code ""} or {@code 0}.
 */
public final class RawBlockRecord {
    private final JsonNode fields;

    public RawBlockRecord(JsonNode fields) {
        this.fields = fields != null && fields.isObject() ? fields : JsonNodeFactory.instance.objectNode();
    }

    public Optional<JsonNode> get(FieldAlias field) {
        return field.resolve(fields);
    }

    public boolean has(FieldAlias field) {
        return get(field).isPresent();
    }

    public String text(FieldAlias field) {
        return get(field).map(RawBlockRecord::asText).orElse("");
    }

    public long number(FieldAlias field) {
        return get(field).map(RawBlockRecord::asLong).orElse(0L);
    }

    public ChainRecord toChainRecord() {
        return new ChainRecord(
                number(FieldAlias.INDEX),
                text(FieldAlias.TIMESTAMP),
                text(FieldAlias.PREVIOUS_HASH),
                text(FieldAlias.MERKLE_ROOT),
                text(FieldAlias.HASH),
                number(FieldAlias.NONCE));
    }

    private static String asText(JsonNode n) {
        if (n.isTextual()) return n.textValue();
        if (n.isValueNode()) return n.asText();
        return "";
    }

    private static long asLong(JsonNode n) {
        if (n.isIntegralNumber() && n.canConvertToLong()) return n.longValue();
        if (n.isTextual()) {
            try {
                return Long.parseLong(n.textValue().trim());
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }
}
