package io.powledger.core.consensus;

/** Per-block diagnostics produced by {@link ChainValidator}. */
public record BlockCheck(long index,
                         boolean hashValid,
                         boolean powValid,
                         boolean indexValid,
                         boolean prevHashValid,
                         boolean blockValid,
                         boolean cascaded) {
}
