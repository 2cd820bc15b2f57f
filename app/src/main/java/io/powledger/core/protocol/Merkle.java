package io.powledger.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Merkle root over big-endian hex txids (Bitcoin-style).
 * - Leaves are flipped to little-endian before hashing; the root is flipped back.
 * - Each parent = doubleSha256(left || right).
 * - If a level has an odd count, the last node is paired with itself.
 * - No leaves: root = 32 zero bytes.
 * Order matters: permuting the leaves changes the root.
 */
public final class Merkle {
    private Merkle(){}

    public static String rootOf(List<String> txids) {
        if (txids == null || txids.isEmpty()) return ProtocolLimits.EMPTY_MERKLE_ROOT;
        List<byte[]> level = new ArrayList<>(txids.size());
        for (String id : txids) level.add(Hex.decodeReversed(id));
        while (level.size() > 1) {
            List<byte[]> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                byte[] left = level.get(i);
                byte[] right = (i + 1 < level.size()) ? level.get(i + 1) : left;
                next.add(Hashes.doubleSha256(concat(left, right)));
            }
            level = next;
        }
        return Hex.encodeReversed(level.get(0));
    }

    public static String rootOfTransactions(List<Transaction> txs) {
        List<String> ids = new ArrayList<>(txs.size());
        for (Transaction tx : txs) ids.add(tx.txid());
        return rootOf(ids);
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
