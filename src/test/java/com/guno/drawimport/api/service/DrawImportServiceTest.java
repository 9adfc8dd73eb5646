package com.guno.drawimport.api.service;

import com.guno.drawimport.DrawImportApplication;
import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.dto.internal.ImportSummary;
import com.guno.drawimport.dto.internal.RunState;
import com.guno.drawimport.entity.DrawRecord;
import com.guno.drawimport.entity.DrawStore;
import com.guno.drawimport.exception.StoreWriteException;
import com.guno.drawimport.repository.DrawStoreRepository;
import com.guno.drawimport.test.util.DrawFixtures;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * DrawImportService Test - full runs against a mocked upstream and a temp store file
 */
@SpringBootTest(classes = DrawImportApplication.class)
@ActiveProfiles("test")
@Slf4j
class DrawImportServiceTest {

    private static final String ENDPOINT = "https://api.test.local/Lottery/BingoResult";
    private static final String HTML_URL = "https://www.test.local/bingo/";

    @Autowired private DrawImportService importService;
    @Autowired private DrawStoreRepository repository;
    @Autowired private DrawSourceProperties properties;
    @Autowired private RestTemplate restTemplate;

    @TempDir
    Path tempDir;

    private MockRestServiceServer server;
    private String originalStorePath;
    private List<String> originalMethods;
    private List<String> originalHtmlUrls;
    private int originalPollAttempts;

    @BeforeEach
    void setUp() {
        server = MockRestServiceServer.bindTo(restTemplate).build();
        originalStorePath = properties.getStore().getPath();
        originalMethods = properties.getApi().getMethods();
        originalHtmlUrls = properties.getHtml().getUrls();
        originalPollAttempts = properties.getHtml().getPollAttempts();
        properties.getStore().setPath(tempDir.resolve("draws.json").toString());
    }

    @AfterEach
    void tearDown() {
        properties.getStore().setPath(originalStorePath);
        properties.getApi().setMethods(originalMethods);
        properties.getHtml().setUrls(originalHtmlUrls);
        properties.getHtml().setPollAttempts(originalPollAttempts);
        properties.getArtifacts().setEnabled(false);
    }

    private static String getPage(int pageNum) {
        return ENDPOINT + "?openDate=2025-08-19&pageNum=" + pageNum + "&pageSize=2";
    }

    private void apiNotFound() {
        server.expect(requestTo(getPage(1))).andRespond(withStatus(HttpStatus.NOT_FOUND));
    }

    private Path storeFile() {
        return tempDir.resolve("draws.json");
    }

    @Test
    void shouldImportAllPagesFromApi() {
        server.expect(requestTo(getPage(1))).andRespond(withSuccess(
                DrawFixtures.json(DrawFixtures.payload(3, DrawFixtures.rows(0, 2))), MediaType.APPLICATION_JSON));
        server.expect(requestTo(getPage(2))).andRespond(withSuccess(
                DrawFixtures.json(DrawFixtures.payload(3, DrawFixtures.rows(2, 1))), MediaType.APPLICATION_JSON));

        ImportSummary summary = importService.runImport(DrawFixtures.DRAW_DATE);

        server.verify();
        log.info("Summary: {}", summary.getSummaryStats());
        assertThat(summary.isSuccess()).isTrue();
        assertThat(summary.getFinalState()).isEqualTo(RunState.DONE);
        assertThat(summary.getSource()).isEqualTo("API");
        assertThat(summary.getRecordsAdded()).isEqualTo(3);
        assertThat(summary.getTotalApiCalls()).isEqualTo(2);
        assertThat(summary.getPreviousMaxPeriod()).isNull();
        assertThat(summary.getNewMaxPeriod()).isEqualTo(DrawFixtures.period(2));
        assertThat(summary.isWritten()).isTrue();
        assertThat(repository.load().toList()).extracting(DrawRecord::getPeriod)
                .containsExactly(DrawFixtures.period(0), DrawFixtures.period(1), DrawFixtures.period(2));
    }

    @Test
    void shouldPinFirstWorkingShapeForLaterPages() {
        properties.getApi().setMethods(List.of("GET", "POST"));

        apiNotFound();
        server.expect(requestTo(ENDPOINT)).andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.pageNum").value(1))
                .andRespond(withSuccess(DrawFixtures.json(DrawFixtures.payload(null, DrawFixtures.rows(0, 2))),
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(ENDPOINT)).andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.pageNum").value(2))
                .andRespond(withSuccess(DrawFixtures.json(DrawFixtures.payload(null, DrawFixtures.rows(2, 1))),
                        MediaType.APPLICATION_JSON));

        ImportSummary summary = importService.runImport(DrawFixtures.DRAW_DATE);

        server.verify();
        assertThat(summary.getPinnedShape()).contains("POST");
        assertThat(summary.getRecordsAdded()).isEqualTo(3);
        assertThat(summary.getTotalApiCalls()).isEqualTo(3);
    }

    @Test
    void shouldEndExhaustedWithoutWritingWhenNothingIsFound() {
        apiNotFound();
        server.expect(requestTo(HTML_URL)).andRespond(withSuccess(
                "<html><body>系統維護中</body></html>", MediaType.TEXT_HTML));

        ImportSummary summary = importService.runImport(DrawFixtures.DRAW_DATE);

        server.verify();
        assertThat(summary.getFinalState()).isEqualTo(RunState.EXHAUSTED);
        assertThat(summary.isNoData()).isTrue();
        assertThat(summary.getRecordsAdded()).isZero();
        assertThat(summary.isWritten()).isFalse();
        assertThat(Files.exists(storeFile())).isFalse();
    }

    @Test
    void shouldFallBackToHtmlPage() {
        apiNotFound();
        server.expect(requestTo(HTML_URL)).andRespond(withSuccess(
                DrawFixtures.htmlPage(DrawFixtures.complete("114046629", 11, 3)), MediaType.TEXT_HTML));

        ImportSummary summary = importService.runImport(DrawFixtures.DRAW_DATE);

        server.verify();
        assertThat(summary.getSource()).isEqualTo("HTML");
        assertThat(summary.getTotalHtmlCalls()).isEqualTo(1);
        assertThat(summary.getRecordsAdded()).isEqualTo(1);
        assertThat(repository.load().get("114046629"))
                .hasValueSatisfying(r -> assertThat(r.getSuperNumber()).isEqualTo(3));
    }

    @Test
    void shouldPollHtmlPageAgainUntilDrawsAppear() throws Exception {
        properties.getHtml().setPollAttempts(2);
        properties.getArtifacts().setEnabled(true);
        properties.getArtifacts().setDirectory(tempDir.resolve("artifacts").toString());

        apiNotFound();
        server.expect(requestTo(HTML_URL)).andRespond(withSuccess(
                "<html><body>開獎中, 請稍候</body></html>", MediaType.TEXT_HTML));
        server.expect(requestTo(HTML_URL)).andRespond(withSuccess(
                DrawFixtures.htmlPage(DrawFixtures.complete("114046629", 11, 3)), MediaType.TEXT_HTML));

        ImportSummary summary = importService.runImport(DrawFixtures.DRAW_DATE);

        server.verify();
        assertThat(summary.getFinalState()).isEqualTo(RunState.DONE);
        assertThat(summary.getSource()).isEqualTo("HTML");
        assertThat(summary.getTotalHtmlCalls()).isEqualTo(2);
        assertThat(summary.getRecordsAdded()).isEqualTo(1);

        Path artifacts = tempDir.resolve("artifacts");
        assertThat(Files.readString(artifacts.resolve("bingo_2025-08-19_html0_poll1.html"), StandardCharsets.UTF_8))
                .contains("請稍候");
        assertThat(Files.readString(artifacts.resolve("bingo_2025-08-19_html0_poll2.html"), StandardCharsets.UTF_8))
                .contains("114046629");
    }

    @Test
    void shouldMoveToNextHtmlPageWhenFetchFails() {
        String secondUrl = "https://www.test.local/bingo/history";
        properties.getHtml().setUrls(List.of(HTML_URL, secondUrl));
        properties.getHtml().setPollAttempts(3);

        apiNotFound();
        server.expect(requestTo(HTML_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(secondUrl)).andRespond(withSuccess(
                DrawFixtures.htmlPage(DrawFixtures.complete("114046629", 11, 3)), MediaType.TEXT_HTML));

        ImportSummary summary = importService.runImport(DrawFixtures.DRAW_DATE);

        server.verify();
        assertThat(summary.getFinalState()).isEqualTo(RunState.DONE);
        assertThat(summary.getPinnedShape()).isEqualTo(secondUrl);
        assertThat(summary.getTotalHtmlCalls()).isEqualTo(2);
    }

    @Test
    void shouldSkipWriteWhenFetchedRowsAreAlreadyStored() throws Exception {
        repository.save(DrawStore.of(List.of(
                DrawFixtures.complete(DrawFixtures.period(0), 1, 80),
                DrawFixtures.complete(DrawFixtures.period(1), 2, 80),
                DrawFixtures.complete(DrawFixtures.period(2), 3, 80))));
        FileTime before = FileTime.fromMillis(0);
        Files.setLastModifiedTime(storeFile(), before);
        String contentBefore = Files.readString(storeFile(), StandardCharsets.UTF_8);

        server.expect(requestTo(getPage(1))).andRespond(withSuccess(
                DrawFixtures.json(DrawFixtures.payload(2, DrawFixtures.rows(1, 2))), MediaType.APPLICATION_JSON));

        ImportSummary summary = importService.runImport(DrawFixtures.DRAW_DATE);

        server.verify();
        assertThat(summary.isSuccess()).isTrue();
        assertThat(summary.isChanged()).isFalse();
        assertThat(summary.isWritten()).isFalse();
        assertThat(Files.getLastModifiedTime(storeFile())).isEqualTo(before);
        assertThat(Files.readString(storeFile(), StandardCharsets.UTF_8)).isEqualTo(contentBefore);
    }

    @Test
    void shouldUpgradeIncompleteStoredDraw() {
        repository.save(DrawStore.of(List.of(DrawFixtures.incomplete(DrawFixtures.period(0), 1))));

        server.expect(requestTo(getPage(1))).andRespond(withSuccess(
                DrawFixtures.json(DrawFixtures.payload(1, DrawFixtures.rows(0, 1))), MediaType.APPLICATION_JSON));

        ImportSummary summary = importService.runImport(DrawFixtures.DRAW_DATE);

        assertThat(summary.getRecordsUpgraded()).isEqualTo(1);
        assertThat(summary.isWritten()).isTrue();
        assertThat(repository.load().get(DrawFixtures.period(0)).orElseThrow().isComplete()).isTrue();
    }

    @Test
    void shouldPropagateStoreWriteFailure() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x", StandardCharsets.UTF_8);
        properties.getStore().setPath(blocker.resolve("draws.json").toString());

        server.expect(requestTo(getPage(1))).andRespond(withSuccess(
                DrawFixtures.json(DrawFixtures.payload(1, DrawFixtures.rows(0, 1))), MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> importService.runImport(DrawFixtures.DRAW_DATE))
                .isInstanceOf(StoreWriteException.class);
    }

    @Test
    void shouldUseConfiguredOpenDate() {
        server.expect(requestTo(getPage(1))).andRespond(withSuccess(
                DrawFixtures.json(DrawFixtures.payload(1, DrawFixtures.rows(0, 1))), MediaType.APPLICATION_JSON));

        ImportSummary summary = importService.runImport();

        server.verify();
        assertThat(summary.getDrawDate()).isEqualTo(DrawFixtures.DRAW_DATE);
    }
}
