package com.candleview.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandleTest {

    @Test
    void parsesCsvAndIgnoresExtraColumns() {
        Candle c = Candle.fromCsv("1700000000, 35000.5,35100,34900.25,35050,123.4,42");

        assertEquals(1700000000L, c.time());
        assertEquals(35000.5, c.open());
        assertEquals(35100.0, c.high());
        assertEquals(34900.25, c.low());
        assertEquals(35050.0, c.close());
    }

    @Test
    void rejectsShortCsvLine() {
        assertThrows(IllegalArgumentException.class, () -> Candle.fromCsv("1700000000,1,2,3"));
    }

    @Test
    void csvOutputParsesBack() {
        Candle c = new Candle(1700003600L, 1.5, 2.25, 1.0, 2.0);
        assertEquals(c, Candle.fromCsv(c.toCsv()));
    }

    @Test
    void readsJsonArray() throws Exception {
        String json = "[{\"time\":1700000000,\"open\":1,\"high\":2,\"low\":0.5,\"close\":1.5,\"volume\":10}]";

        List<Candle> candles = List.of(new ObjectMapper().readValue(json, Candle[].class));

        assertEquals(List.of(new Candle(1700000000L, 1, 2, 0.5, 1.5)), candles);
    }
}
