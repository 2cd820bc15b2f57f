package io.powledger.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.powledger.core.chainio.ChainJson;
import io.powledger.core.node.Node;
import io.powledger.core.node.NodeConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerIntegrationTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private ApiServer server;
    private String base;

    @BeforeEach
    void startServer() throws Exception {
        Node node = Node.inMemory(NodeConfig.defaultLocal().withDifficulty(1).withRandomSeed(5L));
        node.start();
        server = new ApiServer(node, "127.0.0.1", 0);
        server.start();
        base = "http://127.0.0.1:" + server.port();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    @Test
    void chainEndpointReturnsGenesisAndVerdict() throws Exception {
        HttpResponse<String> resp = get("/api/chain");

        assertEquals(200, resp.statusCode());
        JsonNode body = ChainJson.MAPPER.readTree(resp.body());
        assertEquals(1, body.get("chain").size());
        assertTrue(body.get("verdict").get("overallValid").asBoolean());
    }

    @Test
    void mineThenDownloadThenValidate() throws Exception {
        HttpResponse<String> mined = post("/api/mine", "");
        assertEquals(200, mined.statusCode());
        JsonNode mineBody = ChainJson.MAPPER.readTree(mined.body());
        assertEquals(6, mineBody.get("transactions").size());
        assertEquals(1, mineBody.get("block").get("index").asLong());

        HttpResponse<String> download = get("/api/download?format=txt");
        assertEquals(200, download.statusCode());
        assertTrue(download.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        assertTrue(download.headers().firstValue("Content-Disposition").orElse("").contains("blockchain.txt"));
        assertTrue(download.body().startsWith("---\nIndex: 0"));

        HttpResponse<String> validated = post("/api/validate", download.body());
        assertEquals(200, validated.statusCode());
        JsonNode verdict = ChainJson.MAPPER.readTree(validated.body());
        assertEquals(1, verdict.get("difficulty").asInt());
        assertEquals(2, verdict.get("chain").size());
        assertTrue(verdict.get("verdict").get("overallValid").asBoolean());
    }

    @Test
    void garbageUploadIsMalformed() throws Exception {
        HttpResponse<String> resp = post("/api/validate", "this is not a chain");

        assertEquals(400, resp.statusCode());
        assertEquals("malformed_input", ChainJson.MAPPER.readTree(resp.body()).get("error").asText());
    }

    @Test
    void emptyUploadIsMissingFile() throws Exception {
        HttpResponse<String> resp = post("/api/validate", "");

        assertEquals(400, resp.statusCode());
        assertEquals("missing_file", ChainJson.MAPPER.readTree(resp.body()).get("error").asText());
    }

    @Test
    void wrongMethodAndUnknownFormat() throws Exception {
        assertEquals(405, get("/api/mine").statusCode());

        HttpResponse<String> resp = get("/api/download?format=xml");
        assertEquals(400, resp.statusCode());
        assertEquals("invalid_format", ChainJson.MAPPER.readTree(resp.body()).get("error").asText());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create(base + path)).GET().build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create(base + path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }
}
