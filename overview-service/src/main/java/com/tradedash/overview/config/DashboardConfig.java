package com.tradedash.overview.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradedash.analytics.palette.AgingPaletteEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;

@Configuration
public class DashboardConfig {

    @Value("${dashboard.quote-asset:USDT}")
    private String quoteAsset;

    @Value("${dashboard.fresh-window-seconds:300}")
    private long freshWindowSeconds;

    @Value("${dashboard.visual-degradations:12}")
    private int visualDegradations;

    @Value("${dashboard.timezone:UTC}")
    private String timezone;

    @Bean
    public DashboardSettings dashboardSettings() {
        return new DashboardSettings(
            quoteAsset.trim().toUpperCase(Locale.ROOT),
            Duration.ofSeconds(freshWindowSeconds),
            visualDegradations,
            ZoneId.of(timezone));
    }

    @Bean
    public AgingPaletteEngine agingPaletteEngine(DashboardSettings settings) {
        return new AgingPaletteEngine(settings.zone());
    }

    /** Floats read as {@link java.math.BigDecimal} so money never passes through a double. */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
