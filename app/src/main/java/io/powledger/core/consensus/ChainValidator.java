package io.powledger.core.consensus;

import io.powledger.core.protocol.Block;
import io.powledger.core.protocol.BlockHeader;
import io.powledger.core.protocol.Hashes;
import io.powledger.core.protocol.ProtocolLimits;

import java.util.ArrayList;
import java.util.List;

/**
 * Forward validation of an ordered block sequence.
 * <p>
 * Each record is checked for: stored hash == recomputed header hash, proof-of-work,
 * index continuity, and the link to the previous record's stored hash. Once a block
 * fails, every later block is reported as cascaded and invalid, whatever its own
 * checks say.
 * <p>
 * Never throws. A null record is treated as an empty one and simply fails.
 */
public final class ChainValidator {
    private ChainValidator() {}

    public static ChainVerdict validateBlocks(List<Block> blocks, int difficulty) {
        List<ChainRecord> records = new ArrayList<>(blocks.size());
        for (Block b : blocks) records.add(ChainRecord.of(b));
        return validate(records, difficulty);
    }

    public static ChainVerdict validate(List<ChainRecord> records, int difficulty) {
        List<BlockCheck> checks = new ArrayList<>(records.size());
        List<Long> invalid = new ArrayList<>();
        boolean cascaded = false;

        ChainRecord prev = null;
        for (int i = 0; i < records.size(); i++) {
            ChainRecord cur = records.get(i);
            if (cur == null) {
                cur = new ChainRecord(0L, "", "", "", "", 0L);
            }

            String recomputed = Hashes.sha256Hex(BlockHeader.canonical(
                    cur.index(), cur.timestamp(), cur.previousHash(), cur.merkleRoot(), cur.nonce()));
            boolean hashValid = recomputed.equals(cur.hash());
            boolean powValid = ProofOfWork.meetsTarget(cur.hash(), difficulty);
            boolean indexValid = (i == 0) ? cur.index() == 0 : cur.index() == prev.index() + 1;
            boolean prevHashValid = (i == 0)
                    ? ProtocolLimits.GENESIS_PREVIOUS_HASH.equals(cur.previousHash())
                    : cur.previousHash().equals(prev.hash());

            boolean blockValid = !cascaded && hashValid && powValid && indexValid && prevHashValid;
            checks.add(new BlockCheck(cur.index(), hashValid, powValid, indexValid, prevHashValid, blockValid, cascaded));
            if (!blockValid) {
                invalid.add(cur.index());
                cascaded = true;
            }
            prev = cur;
        }
        return new ChainVerdict(invalid.isEmpty(), invalid, checks);
    }
}
