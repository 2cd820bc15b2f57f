package io.powledger.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.powledger.core.chainio.ChainFormat;
import io.powledger.core.chainio.ChainJson;
import io.powledger.core.chainio.ImportedChain;
import io.powledger.core.chainio.MalformedChainException;
import io.powledger.core.metrics.HttpMetrics;
import io.powledger.core.node.ChainSnapshot;
import io.powledger.core.node.MineResult;
import io.powledger.core.node.Node;
import io.powledger.core.state.BlockRejectedException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thin HTTP front for a {@link Node}:
 * <ul>
 *   <li>GET  /api/chain                    blocks + verdict</li>
 *   <li>POST /api/mine                     one mining round</li>
 *   <li>GET  /api/download?format=json|yaml|txt</li>
 *   <li>POST /api/validate                 raw chain file body</li>
 * </ul>
 * Requests run on the server's calling thread; a mine request blocks until its search ends.
 */
public class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());

    private final Node node;
    private final ObjectMapper mapper;
    private final String bindAddress;
    private final int port;
    private HttpServer httpServer;

    public ApiServer(Node node, String bindAddress, int port) {
        this.node = node;
        this.bindAddress = bindAddress == null || bindAddress.isBlank() ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.mapper = ChainJson.MAPPER;
    }

    public void start() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        httpServer.createContext("/api/chain", new ChainHandler());
        httpServer.createContext("/api/mine", new MineHandler());
        httpServer.createContext("/api/download", new DownloadHandler());
        httpServer.createContext("/api/validate", new ValidateHandler());
        httpServer.setExecutor(null);
        httpServer.start();
        LOG.info("API HTTP server started on " + bindAddress + ":" + port());
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
        }
    }

    /** Bound port (differs from the requested one when 0 was requested). */
    public int port() {
        return httpServer != null ? httpServer.getAddress().getPort() : port;
    }

    class ChainHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!"GET".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use GET for this endpoint");
                    return;
                }
                ChainSnapshot snapshot = node.query();
                ObjectNode resp = mapper.createObjectNode();
                resp.set("chain", ChainJson.blocks(snapshot.blocks()));
                resp.set("verdict", ChainJson.verdict(snapshot.verdict()));
                status = sendJson(exchange, 200, resp);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Chain query failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    class MineHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!"POST".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use POST for this endpoint");
                    return;
                }
                Optional<MineResult> mined = node.mine();
                if (mined.isEmpty()) {
                    status = sendError(exchange, 503, "mining_exhausted", "Nonce search ended without a valid header");
                    return;
                }
                MineResult result = mined.get();
                ObjectNode resp = mapper.createObjectNode();
                resp.put("message", "Block mined");
                resp.set("block", ChainJson.block(result.block()));
                resp.set("transactions", ChainJson.transactions(result.transactions()));
                resp.set("verdict", ChainJson.verdict(result.verdict()));
                status = sendJson(exchange, 200, resp);
            } catch (BlockRejectedException e) {
                status = sendError(exchange, 409, "block_rejected", e.getMessage());
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Mining request failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    class DownloadHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!"GET".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use GET for this endpoint");
                    return;
                }
                ChainFormat format;
                try {
                    format = ChainFormat.fromName(queryParam(exchange, "format"));
                } catch (IllegalArgumentException e) {
                    status = sendError(exchange, 400, "invalid_format", e.getMessage());
                    return;
                }
                byte[] payload = node.export(format).getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", format.contentType());
                exchange.getResponseHeaders().set("Content-Disposition",
                        "attachment; filename=\"blockchain." + format.extension() + "\"");
                status = send(exchange, 200, payload);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Chain download failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    class ValidateHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            Path upload = null;
            try {
                if (!"POST".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use POST for this endpoint");
                    return;
                }
                upload = Files.createTempFile("chain-upload-", ".tmp");
                try (InputStream body = exchange.getRequestBody()) {
                    Files.copy(body, upload, StandardCopyOption.REPLACE_EXISTING);
                }
                if (Files.size(upload) == 0) {
                    status = sendError(exchange, 400, "missing_file", "No file uploaded");
                    return;
                }
                ImportedChain imported;
                try {
                    imported = node.validateImportedFile(upload);
                    HttpMetrics.recordImport(true);
                } catch (MalformedChainException e) {
                    HttpMetrics.recordImport(false);
                    status = sendError(exchange, 400, "malformed_input", "Failed to parse blockchain file");
                    return;
                }
                ObjectNode resp = mapper.createObjectNode();
                resp.put("difficulty", imported.difficulty());
                resp.set("chain", ChainJson.records(imported.records()));
                resp.set("verdict", ChainJson.verdict(imported.verdict()));
                status = sendJson(exchange, 200, resp);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Chain validation request failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                deleteQuietly(upload);
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        return send(exchange, status, mapper.writeValueAsBytes(body));
    }

    private int send(HttpExchange exchange, int status, byte[] payload) throws IOException {
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to delete upload " + file, e);
        }
    }

    private String queryParam(HttpExchange exchange, String key) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (key.equals(k)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
