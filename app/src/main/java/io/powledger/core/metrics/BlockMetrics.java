package io.powledger.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class BlockMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksMined = registry.counter("blocks.mined");
    private static final Timer miningTime = registry.timer("block.mining.time");
    private static final DistributionSummary powAttempts = DistributionSummary.builder("pow.search.attempts")
            .description("Header hashes computed per nonce search")
            .register(registry);
    private static final Counter rejectedSpends = Counter.builder("utxo.spend.rejected")
            .description("Spend calls on missing or already spent outputs")
            .register(registry);
    private static final Counter rejectedBlocks = Counter.builder("utxo.block.rejected")
            .description("Blocks refused because an input could not be spent")
            .register(registry);

    public static <T> T recordMining(Supplier<T> blockProductionLogic) {
        return miningTime.record(blockProductionLogic);
    }

    public static void incrementBlocks() {
        blocksMined.increment();
    }

    public static void recordSearchAttempts(long attempts) {
        powAttempts.record(attempts);
    }

    public static void recordRejectedSpend() {
        rejectedSpends.increment();
    }

    public static void recordRejectedBlock() {
        rejectedBlocks.increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
