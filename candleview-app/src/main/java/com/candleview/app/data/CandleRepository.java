package com.candleview.app.data;

import com.candleview.core.model.Candle;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Loads candles per symbol from a data folder.
 *
 * <p>Looks for {@code <SYMBOL>.csv} first, then {@code <SYMBOL>.json}. CSV rows are
 * {@code time,open,high,low,close[,...]} with an optional header; JSON is an array
 * of candle objects. Results are sorted by time. Symbols without a file get a
 * generated hourly sample series, the same for the same symbol and clock.</p>
 */
public class CandleRepository {

    private static final Logger log = LoggerFactory.getLogger(CandleRepository.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final int SAMPLE_BARS = 240;
    public static final long HOUR_SECONDS = 3600L;

    private final Path dataDir;
    private final Clock clock;

    public CandleRepository(Path dataDir) {
        this(dataDir, Clock.systemUTC());
    }

    public CandleRepository(Path dataDir, Clock clock) {
        this.dataDir = dataDir;
        this.clock = clock;
    }

    public Path getDataDir() {
        return dataDir;
    }

    /**
     * Load all candles for a symbol, sorted by time.
     *
     * @throws IOException if the symbol's file exists but cannot be read or parsed
     */
    public List<Candle> load(String symbol) throws IOException {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }

        Optional<Path> file = findFile(symbol.trim());
        if (file.isEmpty()) {
            long end = Math.floorDiv(clock.millis() / 1000L, HOUR_SECONDS) * HOUR_SECONDS;
            log.info("No data file for {}, using sample data", symbol);
            return sample(symbol.trim(), end, SAMPLE_BARS);
        }

        Path path = file.get();
        List<Candle> candles = path.getFileName().toString().endsWith(".csv")
            ? readCsv(path)
            : readJson(path);
        candles.sort(Comparator.comparingLong(Candle::time));
        log.debug("Loaded {} candles for {} from {}", candles.size(), symbol, path);
        return candles;
    }

    /**
     * Data file for a symbol, CSV preferred.
     */
    public Optional<Path> findFile(String symbol) {
        for (String ext : List.of(".csv", ".json")) {
            Path candidate = dataDir.resolve(symbol + ext);
            if (Files.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    List<Candle> readCsv(Path file) throws IOException {
        List<Candle> candles = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;

            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty()) continue;

                // Header
                if (lineNumber == 1 && !Character.isDigit(line.charAt(0))) {
                    continue;
                }

                try {
                    candles.add(Candle.fromCsv(line));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping invalid line {} in {}: {}", lineNumber, file.getFileName(), e.getMessage());
                }
            }
        }

        return candles;
    }

    List<Candle> readJson(Path file) throws IOException {
        Candle[] candles = JSON.readValue(file.toFile(), Candle[].class);
        return new ArrayList<>(Arrays.asList(candles));
    }

    /**
     * Generate an hourly random-walk series ending at {@code endTime}.
     * Seeded by the symbol, so the same arguments give the same candles.
     */
    public static List<Candle> sample(String symbol, long endTime, int count) {
        Random random = new Random(symbol.hashCode());
        List<Candle> candles = new ArrayList<>(count);

        double price = 50 + random.nextDouble() * 150;
        long start = endTime - (long) (count - 1) * HOUR_SECONDS;

        for (int i = 0; i < count; i++) {
            double open = price;
            double close = Math.max(1.0, open * (1 + random.nextGaussian() * 0.01));
            double high = Math.max(open, close) * (1 + random.nextDouble() * 0.005);
            double low = Math.min(open, close) * (1 - random.nextDouble() * 0.005);

            candles.add(new Candle(start + i * HOUR_SECONDS, open, high, low, close));
            price = close;
        }

        return candles;
    }
}
