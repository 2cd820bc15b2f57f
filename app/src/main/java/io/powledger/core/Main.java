package io.powledger.core;

import io.powledger.core.api.ApiServer;
import io.powledger.core.chainio.ChainFormat;
import io.powledger.core.chainio.ImportedChain;
import io.powledger.core.chainio.MalformedChainException;
import io.powledger.core.consensus.ChainVerdict;
import io.powledger.core.metrics.BlockMetrics;
import io.powledger.core.node.MineResult;
import io.powledger.core.node.Node;
import io.powledger.core.node.NodeConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = NodeConfig.defaultLocal()
                .withDifficulty(options.difficulty())
                .withMaxPowTries(options.maxPowTries())
                .withRandomSeed(options.seed());
        Node node = Node.inMemory(config);
        node.start();
        LOG.info("Ledger started at difficulty " + config.difficulty);

        mineRounds(node, options.blocks());
        logVerdict("Live chain", node.validate());

        if (options.exportFile() != null) {
            writeExport(node, options.exportFormat(), options.exportFile());
        }
        if (options.validateFile() != null) {
            validateFile(node, options.validateFile());
        }

        LOG.info("=== Metrics ===\n" + BlockMetrics.scrapeMetrics());

        if (!options.enableApi() && !options.keepAlive()) {
            return;
        }

        ApiServer apiServer = null;
        try {
            if (options.enableApi()) {
                apiServer = new ApiServer(node, options.apiBind(), options.apiPort());
                apiServer.start();
            }
            CountDownLatch shutdownLatch = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "pow-ledger-shutdown"));
            LOG.info("Ledger running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            if (apiServer != null) {
                apiServer.stop();
            }
        }
    }

    private static void mineRounds(Node node, int rounds) {
        for (int i = 0; i < rounds; i++) {
            Optional<MineResult> result = node.mine();
            if (result.isEmpty()) {
                LOG.warning("Mining round " + (i + 1) + " exhausted its attempt budget; stopping");
                return;
            }
        }
    }

    private static void writeExport(Node node, ChainFormat format, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, node.export(format), StandardCharsets.UTF_8);
            LOG.info("Exported " + node.chain().size() + " blocks as " + format + " to " + file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write chain export to " + file, e);
        }
    }

    private static void validateFile(Node node, Path file) {
        try {
            ImportedChain imported = node.validateImportedFile(file);
            logVerdict("Imported chain " + file, imported.verdict());
        } catch (MalformedChainException e) {
            LOG.warning("Could not read " + file + ": " + e.getMessage());
        }
    }

    private static void logVerdict(String label, ChainVerdict verdict) {
        if (verdict.overallValid()) {
            LOG.info(label + ": valid (" + verdict.perBlock().size() + " blocks)");
        } else {
            LOG.warning(label + ": INVALID from block(s) " + verdict.invalidIndices());
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            int difficulty,
            int blocks,
            long maxPowTries,
            Long seed,
            ChainFormat exportFormat,
            Path exportFile,
            Path validateFile,
            boolean enableApi,
            String apiBind,
            int apiPort,
            boolean keepAlive
    ) {
        static CliOptions parse(String[] args) {
            NodeConfig defaults = NodeConfig.defaultLocal();
            boolean showHelp = false;
            String error = null;

            int difficulty = defaults.difficulty;
            int blocks = 3;
            long maxPowTries = defaults.maxPowTries;
            Long seed = null;
            ChainFormat exportFormat = ChainFormat.JSON;
            Path exportFile = null;
            Path validateFile = null;
            boolean enableApi = "true".equalsIgnoreCase(System.getenv("POW_LEDGER_ENABLE_API"));
            String apiBind = envOrDefault("POW_LEDGER_API_BIND", "127.0.0.1");
            int apiPort = 8080;
            boolean keepAlive = "true".equalsIgnoreCase(System.getenv("POW_LEDGER_KEEP_ALIVE"));

            try {
                String envDifficulty = System.getenv("POW_LEDGER_DIFFICULTY");
                if (envDifficulty != null && !envDifficulty.isBlank()) {
                    difficulty = parseDifficulty(envDifficulty, "POW_LEDGER_DIFFICULTY");
                }
                String envPort = System.getenv("POW_LEDGER_API_PORT");
                if (envPort != null && !envPort.isBlank()) {
                    apiPort = parsePort(envPort, "POW_LEDGER_API_PORT");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--difficulty=")) {
                            difficulty = parseDifficulty(arg.substring("--difficulty=".length()), "--difficulty");
                        } else if (arg.startsWith("--blocks=")) {
                            blocks = (int) parseNonNegativeLong(arg.substring("--blocks=".length()), "--blocks");
                        } else if (arg.startsWith("--max-pow-tries=")) {
                            maxPowTries = parseNonNegativeLong(arg.substring("--max-pow-tries=".length()), "--max-pow-tries");
                        } else if (arg.startsWith("--seed=")) {
                            seed = parseSeed(arg.substring("--seed=".length()));
                        } else if (arg.startsWith("--export=")) {
                            exportFormat = ChainFormat.fromName(arg.substring("--export=".length()));
                        } else if (arg.startsWith("--export-file=")) {
                            exportFile = Path.of(arg.substring("--export-file=".length()));
                        } else if (arg.startsWith("--validate-file=")) {
                            validateFile = Path.of(arg.substring("--validate-file=".length()));
                        } else if (arg.equals("--enable-api")) {
                            enableApi = true;
                        } else if (arg.startsWith("--api-bind=")) {
                            apiBind = arg.substring("--api-bind=".length());
                        } else if (arg.startsWith("--api-port=")) {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } else if (arg.equals("--keep-alive")) {
                            keepAlive = true;
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            return new CliOptions(
                    showHelp,
                    error,
                    difficulty,
                    blocks,
                    maxPowTries,
                    seed,
                    exportFormat,
                    exportFile,
                    validateFile,
                    enableApi,
                    apiBind,
                    apiPort,
                    keepAlive
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: pow-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --difficulty=<n>           Leading zero hex characters required in block hashes (default 3)
  --blocks=<n>               Mining rounds to run at startup (default 3)
  --max-pow-tries=<n>        Cap on nonce attempts per block, 0 = unbounded (default 0)
  --seed=<n>                 Seed for the synthetic workload generator
  --export=<json|yaml|txt>   Format for --export-file (default json)
  --export-file=<path>       Write the chain to this file after mining
  --validate-file=<path>     Validate a chain file in any export format
  --enable-api               Start the REST API server (default bind 127.0.0.1:8080)
  --api-bind=<host>          Bind address for the REST API
  --api-port=<port>          Port for the REST API (default 8080)
  --keep-alive               Keep the process running until interrupted

Environment overrides:
  POW_LEDGER_DIFFICULTY      Default for --difficulty
  POW_LEDGER_ENABLE_API      Set to "true" to enable the REST API without the flag
  POW_LEDGER_API_BIND        Default for --api-bind
  POW_LEDGER_API_PORT        Default for --api-port
  POW_LEDGER_KEEP_ALIVE      Set to "true" to force keep-alive mode
""");
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int parseDifficulty(String value, String flag) {
            try {
                int d = Integer.parseInt(value.trim());
                if (d < 0 || d > 64) {
                    throw new NumberFormatException();
                }
                return d;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value.trim());
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parseNonNegativeLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed < 0 || ("--blocks".equals(flag) && parsed > Integer.MAX_VALUE)) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static Long parseSeed(String value) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for --seed: " + value);
            }
        }
    }
}
