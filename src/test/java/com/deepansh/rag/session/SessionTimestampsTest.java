package com.deepansh.rag.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionTimestampsTest {

    private static final Instant FALLBACK = Instant.parse("2000-01-01T00:00:00Z");

    @Test
    void toInstant_epochSecondsWithFraction() {
        Instant result = SessionTimestamps.toInstant(1_700_000_000.25, FALLBACK);

        assertThat(result).isEqualTo(Instant.ofEpochSecond(1_700_000_000L, 250_000_000));
    }

    @Test
    void toInstant_acceptsLongBigDecimalAndNumericString() {
        Instant expected = Instant.ofEpochSecond(1_700_000_000L);

        assertThat(SessionTimestamps.toInstant(1_700_000_000L, FALLBACK)).isEqualTo(expected);
        assertThat(SessionTimestamps.toInstant(new BigDecimal("1700000000"), FALLBACK)).isEqualTo(expected);
        assertThat(SessionTimestamps.toInstant("1700000000", FALLBACK)).isEqualTo(expected);
    }

    @Test
    void toInstant_isoStringAndInstantPassThrough() {
        Instant instant = Instant.parse("2024-05-01T10:15:30Z");

        assertThat(SessionTimestamps.toInstant("2024-05-01T10:15:30Z", FALLBACK)).isEqualTo(instant);
        assertThat(SessionTimestamps.toInstant(instant, FALLBACK)).isSameAs(instant);
    }

    @Test
    void toInstant_nullOrBlank_usesFallback() {
        assertThat(SessionTimestamps.toInstant(null, FALLBACK)).isEqualTo(FALLBACK);
        assertThat(SessionTimestamps.toInstant("  ", FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    void toInstant_unsupportedType_throws() {
        assertThatThrownBy(() -> SessionTimestamps.toInstant(new Object(), FALLBACK))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deserializer_readsLegacyAndIsoTimestamps() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

        SessionRecord legacy = mapper.readValue(
                "{\"sessionId\":\"s1\",\"createdAt\":1700000000.5,\"lastAccessed\":\"1700000100\"}",
                SessionRecord.class);
        TurnMetadata meta = mapper.readValue(
                "{\"messageId\":\"m1\",\"timestamp\":\"2024-05-01T10:15:30Z\",\"tokensUsed\":12}",
                TurnMetadata.class);

        assertThat(legacy.getCreatedAt()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L, 500_000_000));
        assertThat(legacy.getLastAccessed()).isEqualTo(Instant.ofEpochSecond(1_700_000_100L));
        assertThat(meta.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:15:30Z"));
        assertThat(meta.getTokensUsed()).isEqualTo(12);
    }
}
