package io.powledger.core.chainio;

import io.powledger.core.consensus.ChainRecord;
import io.powledger.core.consensus.ChainVerdict;

import java.util.List;

/** Result of validating an externally supplied chain against a node's difficulty. */
public record ImportedChain(int difficulty, List<ChainRecord> records, ChainVerdict verdict) {
    public ImportedChain {
        records = List.copyOf(records);
    }
}
