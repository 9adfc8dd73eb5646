package com.guno.drawimport.util;

import com.guno.drawimport.config.DrawSourceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.*;

class DrawDateResolverTest {

    private DrawSourceProperties properties;
    private DrawDateResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new DrawSourceProperties();
        resolver = new DrawDateResolver(properties);
    }

    @Test
    void shouldUseTaipeiCalendarDay() {
        // 2025-08-18 17:30 UTC is already 2025-08-19 in Taipei
        Clock clock = Clock.fixed(Instant.parse("2025-08-18T17:30:00Z"), ZoneId.of("Asia/Taipei"));

        assertThat(resolver.resolveDrawDate(clock)).isEqualTo(LocalDate.of(2025, 8, 19));
        assertThat(resolver.getZoneId()).isEqualTo(ZoneId.of("Asia/Taipei"));
    }

    @Test
    void shouldPreferConfiguredOpenDate() {
        properties.getRun().setOpenDate(" 2025-01-02 ");

        assertThat(resolver.resolveDrawDate()).isEqualTo(LocalDate.of(2025, 1, 2));
    }

    @Test
    void shouldRejectMalformedOpenDate() {
        properties.getRun().setOpenDate("19/08/2025");

        assertThatThrownBy(() -> resolver.resolveDrawDate()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFallBackOnInvalidZone() {
        properties.setZone("Mars/Olympus");

        assertThat(resolver.getZoneId()).isEqualTo(ZoneId.of("Asia/Taipei"));
    }
}
