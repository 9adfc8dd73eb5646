package com.guno.drawimport.api.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.drawimport.config.DrawSourceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ResponseExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ResponseExtractor extractor;

    @BeforeEach
    void setUp() {
        DrawSourceProperties properties = new DrawSourceProperties();
        properties.getApi().setContainerPaths(List.of("content.bingoQueryResult", "content.list", "data.rows", "$"));
        properties.getApi().setTotalCountPaths(List.of("content.totalSize", "data.total"));
        extractor = new ResponseExtractor(properties);
    }

    @Test
    void shouldUseFirstNonEmptyContainerInPriorityOrder() throws Exception {
        JsonNode payload = mapper.readTree(
                "{\"content\":{\"bingoQueryResult\":[],\"list\":[{\"a\":1},{\"a\":2}]},\"data\":{\"rows\":[{\"b\":1}]}}");

        List<JsonNode> rows = extractor.extractRows(payload);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).get("a").asInt()).isEqualTo(1);
    }

    @Test
    void shouldAcceptBareTopLevelArray() throws Exception {
        assertThat(extractor.extractRows(mapper.readTree("[{\"x\":1}]"))).hasSize(1);
    }

    @Test
    void shouldReturnEmptyWhenNothingMatches() throws Exception {
        assertThat(extractor.extractRows(mapper.readTree("{\"content\":{\"list\":\"oops\"},\"code\":200}"))).isEmpty();
        assertThat(extractor.extractRows(mapper.readTree("\"text\""))).isEmpty();
        assertThat(extractor.extractRows(null)).isEmpty();
    }

    @Test
    void shouldReadTotalCountHintFromNumberOrDigitString() throws Exception {
        assertThat(extractor.totalCountHint(mapper.readTree("{\"content\":{\"totalSize\":203}}"))).contains(203);
        assertThat(extractor.totalCountHint(mapper.readTree("{\"data\":{\"total\":\" 41 \"}}"))).contains(41);
        assertThat(extractor.totalCountHint(mapper.readTree("{\"data\":{\"total\":\"many\"}}"))).isEmpty();
        assertThat(extractor.totalCountHint(mapper.readTree("{\"content\":{}}"))).isEmpty();
    }

    @Test
    void shouldSkipTotalCountHintTooLargeForInt() throws Exception {
        assertThat(extractor.totalCountHint(mapper.readTree("{\"content\":{\"totalSize\":4294967296}}"))).isEmpty();
        assertThat(extractor.totalCountHint(
                mapper.readTree("{\"content\":{\"totalSize\":4294967296},\"data\":{\"total\":12}}"))).contains(12);
    }

    @Test
    void shouldResolveDottedPaths() throws Exception {
        JsonNode root = mapper.readTree("{\"a\":{\"b\":{\"c\":[1]}}}");

        assertThat(ResponseExtractor.resolve(root, "a.b.c").isArray()).isTrue();
        assertThat(ResponseExtractor.resolve(root, "a.x.c")).isNull();
        assertThat(ResponseExtractor.resolve(root, "$")).isSameAs(root);
    }
}
