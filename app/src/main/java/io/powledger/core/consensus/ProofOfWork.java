package io.powledger.core.consensus;

import io.powledger.core.protocol.BlockHeader;

import java.util.function.BooleanSupplier;

/**
 * Leading-zero proof-of-work over the hex header hash.
 * <p>
 * Difficulty is the number of leading {@code '0'} hex characters required, so each
 * step multiplies the expected work by 16. The search is a plain loop on the calling
 * thread; callers bound it with {@code maxAttempts} and/or a cancellation check.
 */
public final class ProofOfWork {

    /** How often (in attempts) the cancellation check is polled. */
    private static final long CANCEL_POLL_INTERVAL = 1024;

    /** Does {@code hash} carry at least {@code difficulty} leading zero hex characters? */
    public static boolean meetsTarget(String hash, int difficulty) {
        if (difficulty <= 0) return true;
        if (hash == null || hash.length() < difficulty) return false;
        for (int i = 0; i < difficulty; i++) {
            if (hash.charAt(i) != '0') return false;
        }
        return true;
    }

    public SearchResult search(BlockHeader template, int difficulty, long maxAttempts) {
        return search(template, difficulty, maxAttempts, () -> false);
    }

    /**
     * Tries nonces 0, 1, 2, ... on top of {@code template}.
     *
     * @param maxAttempts upper bound on hashes computed; {@code <= 0} means unbounded
     * @param cancelled   polled periodically; returning true ends the search as exhausted
     */
    public SearchResult search(BlockHeader template, int difficulty, long maxAttempts, BooleanSupplier cancelled) {
        long limit = maxAttempts <= 0 ? Long.MAX_VALUE : maxAttempts;
        long attempts = 0;
        for (long nonce = 0; attempts < limit; nonce++) {
            if (attempts % CANCEL_POLL_INTERVAL == 0 && attempts > 0 && cancelled.getAsBoolean()) {
                break;
            }
            BlockHeader candidate = template.withNonce(nonce);
            String hash = candidate.hash();
            attempts++;
            if (meetsTarget(hash, difficulty)) {
                return SearchResult.found(candidate, hash, attempts);
            }
        }
        return SearchResult.exhausted(attempts);
    }
}
