package com.guno.drawimport.util;

import com.guno.drawimport.config.DrawSourceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keeps a fixed minimum gap between consecutive upstream requests of a run. Runs are
 * single-threaded, so the last-request timestamp is plain state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestPacer {

    private final DrawSourceProperties properties;

    private long lastRequestNanos = -1;

    public void awaitTurn() {
        long pacingMs = properties.getHttp().getPacingMs();
        if (pacingMs > 0 && lastRequestNanos >= 0) {
            long elapsedMs = (System.nanoTime() - lastRequestNanos) / 1_000_000;
            long waitMs = pacingMs - elapsedMs;
            if (waitMs > 0) {
                log.trace("Pacing upstream request by {}ms", waitMs);
                sleep(waitMs);
            }
        }
        lastRequestNanos = System.nanoTime();
    }

    /**
     * Sleep that restores the interrupt flag instead of throwing.
     *
     * @return false when interrupted
     */
    public static boolean sleep(long millis) {
        if (millis <= 0) return true;
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
