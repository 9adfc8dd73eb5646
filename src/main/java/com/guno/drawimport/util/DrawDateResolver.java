package com.guno.drawimport.util;

import com.guno.drawimport.config.DrawSourceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Draw Date Resolver - which draw date a run asks the sources for
 *
 * An explicit {@code bingo.run.open-date} wins; otherwise "today" in the reference zone
 * ({@code bingo.zone}, Asia/Taipei by default). The draw day is a Taiwan calendar day, so the
 * machine zone is never used.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DrawDateResolver {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final DrawSourceProperties properties;

    public LocalDate resolveDrawDate() {
        return resolveDrawDate(Clock.system(getZoneId()));
    }

    LocalDate resolveDrawDate(Clock clock) {
        String configured = properties.getRun().getOpenDate();
        if (configured != null && !configured.isBlank()) {
            try {
                LocalDate date = LocalDate.parse(configured.trim());
                log.info("📅 Draw Date: {} (CONFIGURED)", date);
                return date;
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(
                        "bingo.run.open-date must be yyyy-MM-dd, got: " + configured, e);
            }
        }

        LocalDateTime now = LocalDateTime.now(clock);
        log.info("📅 Draw Date: {} (TODAY) at {} {}",
                now.toLocalDate(), now.format(TIME_FORMATTER), clock.getZone().getId());
        return now.toLocalDate();
    }

    public ZoneId getZoneId() {
        try {
            return ZoneId.of(properties.getZone());
        } catch (Exception e) {
            log.warn("⚠️ Invalid zone '{}', falling back to Asia/Taipei", properties.getZone());
            return ZoneId.of("Asia/Taipei");
        }
    }
}
