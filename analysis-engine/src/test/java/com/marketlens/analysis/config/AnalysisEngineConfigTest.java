package com.marketlens.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketlens.analysis.CandleFixtures;
import com.marketlens.analysis.dto.AnalysisRequest;
import com.marketlens.analysis.dto.SeriesPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisEngineConfigTest {

    private final ObjectMapper mapper = new AnalysisEngineConfig().objectMapper();

    @Test
    @DisplayName("a request written by the engine's mapper is read back by the same mapper")
    void requestWrittenThenRead() throws Exception {
        AnalysisRequest request = new AnalysisRequest("MSFT", "1h", CandleFixtures.uptrend(5),
            new SeriesPayload("SPY", CandleFixtures.flat(5)), null,
            List.of(new SeriesPayload("QQQ", CandleFixtures.downtrend(5))));

        String json = mapper.writeValueAsString(request);
        assertFalse(json.contains("bullish"));

        AnalysisRequest read = mapper.readValue(json, AnalysisRequest.class);
        assertEquals(request, read);
    }

    @Test
    @DisplayName("unknown request fields are ignored")
    void unknownFieldsIgnored() throws Exception {
        AnalysisRequest read = mapper.readValue(
            "{\"symbol\":\"BTC\",\"client_id\":\"x\",\"candles\":[],"
                + "\"comparison\":{\"symbol\":\"ETH\",\"candles\":[],\"source\":\"feed\"}}",
            AnalysisRequest.class);
        assertEquals("BTC", read.symbol());
        assertEquals("ETH", read.comparison().symbol());
    }

    @Test
    @DisplayName("instants are written as ISO-8601 strings")
    void isoInstants() throws Exception {
        String json = mapper.writeValueAsString(CandleFixtures.uptrend(1).get(0));
        assertTrue(json.contains("\"timestamp\":\"2024-01-01T00:00:00Z\""));
    }
}
