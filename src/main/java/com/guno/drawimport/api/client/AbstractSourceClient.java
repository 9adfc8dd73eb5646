package com.guno.drawimport.api.client;

import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.dto.internal.FetchAttemptResult;
import com.guno.drawimport.dto.internal.FetchOutcome;
import com.guno.drawimport.util.RequestPacer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.client.UnknownHttpStatusCodeException;

import java.util.Map;

/**
 * Transport Client base - executes one logical call and classifies the outcome.
 *
 * <p>Transport failures and 5xx are retried on the same request with linear backoff up to
 * {@code bingo.retry.max-retries} attempts. 4xx is returned at once. Every physical request
 * goes through the shared {@link RequestPacer}.
 */
@Slf4j
public abstract class AbstractSourceClient {

    protected final RestTemplate restTemplate;
    protected final DrawSourceProperties properties;
    private final RequestPacer pacer;

    protected AbstractSourceClient(RestTemplate restTemplate, DrawSourceProperties properties, RequestPacer pacer) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.pacer = pacer;
    }

    /**
     * Turn a 2xx body into a result; subclasses decide what counts as empty.
     */
    protected abstract FetchAttemptResult interpretBody(String url, int statusCode, String body);

    protected FetchAttemptResult exchangeWithRetry(RequestEntity<?> request) {
        int maxAttempts = Math.max(1, properties.getRetry().getMaxRetries());
        long backoffMs = properties.getRetry().getBackoffMs();
        String url = request.getUrl().toString();

        FetchAttemptResult last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            log.debug("{} {} - attempt {}/{}", request.getMethod(), url, attempt, maxAttempts);

            pacer.awaitTurn();
            last = exchangeOnce(request, url);
            last.setAttempts(attempt);

            if (!last.getOutcome().isRetryable()) {
                return last;
            }

            log.warn("Upstream call failed - attempt {}/{}, outcome: {}, status: {}, cause: {}",
                    attempt, maxAttempts, last.getOutcome(), last.getStatusCode(), last.getFailureMessage());

            if (attempt < maxAttempts && !RequestPacer.sleep(backoffMs * attempt)) {
                log.warn("Retry backoff interrupted - giving up on {}", url);
                break;
            }
        }

        log.warn("Abandoning {} after {} attempt(s): {}", url, last.getAttempts(), last.getOutcome());
        return last;
    }

    protected void applyConfiguredHeaders(HttpHeaders headers) {
        Map<String, String> configured = properties.getApi().getHeaders();
        if (configured == null) return;
        configured.forEach((name, value) -> {
            if (name != null && value != null && !value.isBlank()) {
                headers.set(name, value);
            }
        });
    }

    private FetchAttemptResult exchangeOnce(RequestEntity<?> request, String url) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(request, String.class);
            int status = response.getStatusCode().value();

            if (!response.getStatusCode().is2xxSuccessful()) {
                return FetchAttemptResult.failure(FetchOutcome.CLIENT_ERROR, url, status,
                        "Unexpected status " + status);
            }

            String body = response.getBody();
            if (body == null || body.isBlank()) {
                return FetchAttemptResult.failure(FetchOutcome.EMPTY_RESULT, url, status, "Blank body");
            }

            return interpretBody(url, status, body);

        } catch (HttpClientErrorException e) {
            return FetchAttemptResult.failure(FetchOutcome.CLIENT_ERROR, url, e.getStatusCode().value(), e.getStatusText());
        } catch (HttpServerErrorException e) {
            return FetchAttemptResult.failure(FetchOutcome.SERVER_ERROR, url, e.getStatusCode().value(), e.getStatusText());
        } catch (UnknownHttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            FetchOutcome outcome = status >= 500 ? FetchOutcome.SERVER_ERROR : FetchOutcome.CLIENT_ERROR;
            return FetchAttemptResult.failure(outcome, url, status, e.getStatusText());
        } catch (RestClientException e) {
            return FetchAttemptResult.failure(FetchOutcome.TRANSPORT_FAILURE, url, null, safeMsg(e));
        }
    }

    protected static String safeMsg(Exception e) {
        if (e == null) return "unknown";
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }
}
