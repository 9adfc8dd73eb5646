package com.guno.drawimport.api.client;

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

import java.net.URI;
import java.util.List;

/**
 * Draw Page Client - downloads the HTML result pages used after the API is exhausted
 */
@Component
@Slf4j
public class DrawPageClient extends AbstractSourceClient {

    public DrawPageClient(RestTemplate restTemplate, DrawSourceProperties properties, RequestPacer pacer) {
        super(restTemplate, properties, pacer);
    }

    public FetchAttemptResult fetchDocument(String url) {
        HttpHeaders headers = new HttpHeaders();
        applyConfiguredHeaders(headers);
        headers.setAccept(List.of(MediaType.TEXT_HTML, MediaType.ALL));

        FetchAttemptResult result = exchangeWithRetry(new RequestEntity<>(headers, HttpMethod.GET, URI.create(url)));
        log.debug("HTML {} -> {} (status: {}, attempts: {})",
                url, result.getOutcome(), result.getStatusCode(), result.getAttempts());
        return result;
    }

    @Override
    protected FetchAttemptResult interpretBody(String url, int statusCode, String body) {
        return FetchAttemptResult.builder()
                .outcome(FetchOutcome.SUCCESS)
                .url(url)
                .statusCode(statusCode)
                .body(body)
                .build();
    }
}
