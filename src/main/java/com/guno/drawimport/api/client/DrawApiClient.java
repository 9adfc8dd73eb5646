package com.guno.drawimport.api.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.drawimport.api.explore.CandidateRequestShape;
import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.dto.internal.FetchAttemptResult;
import com.guno.drawimport.dto.internal.FetchOutcome;
import com.guno.drawimport.util.RequestPacer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Draw API Client - fetches one page of draw results for one candidate shape
 *
 * GET shapes send the parameters as query string, POST shapes as a JSON body.
 */
@Component
@Slf4j
public class DrawApiClient extends AbstractSourceClient {

    private final ObjectMapper objectMapper;

    public DrawApiClient(RestTemplate restTemplate, DrawSourceProperties properties,
                         RequestPacer pacer, ObjectMapper objectMapper) {
        super(restTemplate, properties, pacer);
        this.objectMapper = objectMapper;
    }

    /**
     * Fetch a page of a shape.
     *
     * @param pageOffset 0 for the first page; the shape adds its own index origin
     */
    public FetchAttemptResult fetchPage(CandidateRequestShape shape, LocalDate date, int pageOffset, int pageSize) {
        Map<String, Object> params = shape.parameters(date, pageOffset, pageSize);
        RequestEntity<?> request = buildRequest(shape, params);

        FetchAttemptResult result = exchangeWithRetry(request);
        log.debug("Shape {} page {} -> {} (status: {}, attempts: {})",
                shape.getOrdinal(), pageOffset + shape.getPageIndexOrigin(),
                result.getOutcome(), result.getStatusCode(), result.getAttempts());
        return result;
    }

    @Override
    protected FetchAttemptResult interpretBody(String url, int statusCode, String body) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            String preview = body.substring(0, Math.min(body.length(), 200));
            log.debug("Non-JSON response from {}: {}", url, preview);
            return FetchAttemptResult.failure(FetchOutcome.EMPTY_RESULT, url, statusCode, "Non-JSON body");
        }

        if (payload == null || payload.isNull() || payload.isMissingNode()
                || (payload.isContainerNode() && payload.isEmpty())) {
            return FetchAttemptResult.failure(FetchOutcome.EMPTY_RESULT, url, statusCode, "Empty JSON payload");
        }

        return FetchAttemptResult.builder()
                .outcome(FetchOutcome.SUCCESS)
                .url(url)
                .statusCode(statusCode)
                .body(body)
                .payload(payload)
                .build();
    }

    private RequestEntity<?> buildRequest(CandidateRequestShape shape, Map<String, Object> params) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.ALL));
        applyConfiguredHeaders(headers);

        if (HttpMethod.POST.equals(shape.getMethod())) {
            headers.setContentType(MediaType.APPLICATION_JSON);
            URI uri = UriComponentsBuilder.fromHttpUrl(shape.getEndpoint()).build().toUri();
            return new RequestEntity<>(params, headers, HttpMethod.POST, uri);
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(shape.getEndpoint());
        params.forEach((key, value) -> builder.queryParam(key, value));
        URI uri = builder.encode().build().toUri();
        return new RequestEntity<>(headers, shape.getMethod(), uri);
    }
}
