package com.webtomd.app.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.CrawlReport;
import com.webtomd.core.model.SelectorType;
import com.webtomd.core.service.NoContainerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.helpers.NOPLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class DownloadServerTest {

    @TempDir Path tmp;

    private final ObjectMapper om = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final AtomicReference<CrawlConfig> seen = new AtomicReference<>();
    private DownloadServer server;

    /** 실제 크롤 대신 받은 설정대로 파일만 만든다 */
    private DownloadServer.CrawlRunner fakeRunner() {
        return cfg -> {
            seen.set(cfg);
            Path doc = cfg.getOutputRoot().resolve("ex.com").resolve(cfg.getOutputFilename());
            try {
                Files.createDirectories(doc.getParent());
                Files.writeString(doc, "# Contents\n");
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return new CrawlReport(doc, List.of(cfg.getBaseUrl()), List.of());
        };
    }

    private void start(DownloadServer.CrawlRunner runner) throws Exception {
        server = new DownloadServer(new InetSocketAddress("127.0.0.1", 0), tmp, Duration.ZERO, runner, NOPLogger.NOP_LOGGER);
        server.start();
    }

    @AfterEach
    void stop() {
        if (server != null) server.stop();
    }

    private HttpResponse<String> post(String json) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + DownloadServer.PATH))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void returnsMarkdownAsAttachment() throws Exception {
        start(fakeRunner());

        HttpResponse<String> res = post("{\"url\":\"https://ex.com/\",\"config\":{\"type\":\"class\",\"value\":\"nav\"},"
                + "\"filename\":\"my guide.md\"}");

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v).startsWith("text/markdown"));
        assertThat(res.headers().firstValue("Content-Disposition"))
                .contains("attachment; filename*=UTF-8''my%20guide.md");
        assertThat(res.body()).isEqualTo("# Contents\n");
        assertThat(seen.get().getSelectorType()).isEqualTo(SelectorType.CLASS);
        assertThat(seen.get().getOutputRoot()).isEqualTo(tmp);
    }

    @Test
    void defaultsFilenameAndPrefersTopLevelPreRemoval() throws Exception {
        start(fakeRunner());

        HttpResponse<String> res = post("{\"url\":\"https://ex.com/\","
                + "\"config\":{\"type\":\"id\",\"value\":\"menu\",\"pre_remove_type\":\"tag\",\"pre_remove_value\":\"footer\"},"
                + "\"pre_remove_type\":\"class\",\"pre_remove_value\":\"ads|banner\"}");

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(seen.get().getOutputFilename()).isEqualTo("tutorial.md");
        assertThat(seen.get().getPreRemoveType()).isEqualTo(SelectorType.CLASS);
        assertThat(seen.get().preRemoveValues()).containsExactly("ads", "banner");
    }

    @Test
    @DisplayName("요청 config 의 output_dir/delay/timeout_ms 는 무시, 서버 설정 유지")
    void requestCannotOverrideServerOutputOrDelay() throws Exception {
        start(fakeRunner());
        Path elsewhere = tmp.resolveSibling(tmp.getFileName() + "-elsewhere");

        HttpResponse<String> res = post("{\"url\":\"https://ex.com/\",\"config\":{\"type\":\"class\",\"value\":\"nav\","
                + "\"output_dir\":\"" + elsewhere.toString().replace("\\", "\\\\") + "\",\"delay\":3600,\"timeout_ms\":1}}");

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(seen.get().getOutputRoot()).isEqualTo(tmp);
        assertThat(seen.get().getRequestDelay()).isEqualTo(Duration.ZERO);
        assertThat(seen.get().getTimeout()).isEqualTo(CrawlConfig.DEFAULT_TIMEOUT);
        assertThat(elsewhere).doesNotExist();
    }

    @Test
    void invalidRequestsAre400WithDetail() throws Exception {
        start(fakeRunner());

        for (String body : List.of(
                "not json",
                "{\"config\":{\"type\":\"class\",\"value\":\"nav\"}}",
                "{\"url\":\"https://ex.com/\"}",
                "{\"url\":\"https://ex.com/\",\"config\":{\"type\":\"xpath\",\"value\":\"nav\"}}",
                "{\"url\":\"https://ex.com/\",\"config\":{\"type\":\"class\",\"value\":\"nav\"},\"filename\":\"../x.md\"}")) {
            HttpResponse<String> res = post(body);
            assertThat(res.statusCode()).as(body).isEqualTo(400);
            JsonNode json = om.readTree(res.body());
            assertThat(json.path("detail").asText()).as(body).isNotBlank();
        }
        assertThat(seen.get()).isNull();
    }

    @Test
    void crawlFailureIs500WithDetail() throws Exception {
        start(cfg -> { throw new NoContainerException(SelectorType.CLASS, "nav"); });

        HttpResponse<String> res = post("{\"url\":\"https://ex.com/\",\"config\":{\"type\":\"class\",\"value\":\"nav\"}}");

        assertThat(res.statusCode()).isEqualTo(500);
        assertThat(om.readTree(res.body()).path("detail").asText()).contains("no link container found");
    }

    @Test
    void otherMethodsAre405() throws Exception {
        start(fakeRunner());

        HttpRequest get = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + DownloadServer.PATH)).GET().build();
        HttpResponse<String> res = client.send(get, HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(405);
    }
}
