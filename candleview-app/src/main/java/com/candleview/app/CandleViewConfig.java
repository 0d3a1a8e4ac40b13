package com.candleview.app;

import com.candleview.charts.config.ChartViewConfig;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the CandleView viewer.
 * Stored in ~/.candleview/config.yaml
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CandleViewConfig {

    private static final Logger log = LoggerFactory.getLogger(CandleViewConfig.class);
    private static final ObjectMapper YAML;

    static {
        YAMLFactory factory = new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER);
        YAML = new ObjectMapper(factory);
    }

    public static final Path CONFIG_DIR = Path.of(System.getProperty("user.home"), ".candleview");
    public static final Path CONFIG_FILE = CONFIG_DIR.resolve("config.yaml");

    public static final String DARK = "dark";
    public static final String LIGHT = "light";

    // Folder with <SYMBOL>.csv / <SYMBOL>.json candle files
    private String dataDir = "~/.candleview/data";

    // Symbols offered in the toolbar
    private List<String> symbols = new ArrayList<>(List.of("AAPL", "MSFT", "BTCUSDT"));

    private String defaultSymbol = "AAPL";

    // "dark" or "light"
    private String lookAndFeel = DARK;

    private ChartViewConfig chart = new ChartViewConfig();

    public CandleViewConfig() {
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    /**
     * Data folder with a leading ~ expanded to the user's home.
     */
    @JsonIgnore
    public Path getDataPath() {
        String path = dataDir;
        if (path.startsWith("~")) {
            path = System.getProperty("user.home") + path.substring(1);
        }
        return Path.of(path);
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public void setSymbols(List<String> symbols) {
        this.symbols = symbols;
    }

    public String getDefaultSymbol() {
        return defaultSymbol;
    }

    public void setDefaultSymbol(String defaultSymbol) {
        this.defaultSymbol = defaultSymbol;
    }

    public String getLookAndFeel() {
        return lookAndFeel;
    }

    public void setLookAndFeel(String lookAndFeel) {
        this.lookAndFeel = lookAndFeel;
    }

    public ChartViewConfig getChart() {
        return chart;
    }

    public void setChart(ChartViewConfig chart) {
        this.chart = chart;
    }

    /**
     * Symbol to show first: the default if it is listed, else the first listed one.
     */
    @JsonIgnore
    public String getInitialSymbol() {
        if (symbols == null || symbols.isEmpty() || symbols.contains(defaultSymbol)) {
            return defaultSymbol;
        }
        return symbols.get(0);
    }

    /**
     * Load config from the default file or create it.
     */
    public static CandleViewConfig load() {
        return load(CONFIG_FILE);
    }

    /**
     * Load config from a file. Missing file creates and saves defaults,
     * unreadable file falls back to defaults.
     */
    public static CandleViewConfig load(Path file) {
        if (!Files.exists(file)) {
            return createDefault(file);
        }
        try {
            CandleViewConfig config = YAML.readValue(file.toFile(), CandleViewConfig.class);
            if (config.chart == null) {
                config.chart = new ChartViewConfig();
            }
            return config;
        } catch (IOException e) {
            log.warn("Failed to load config {}, using defaults: {}", file, e.getMessage());
            return new CandleViewConfig();
        }
    }

    /**
     * Save config to a file, creating parent folders.
     */
    public void save(Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            YAML.writeValue(file.toFile(), this);
        } catch (IOException e) {
            log.error("Failed to save config {}: {}", file, e.getMessage());
        }
    }

    /**
     * Create and save default config.
     */
    public static CandleViewConfig createDefault(Path file) {
        CandleViewConfig config = new CandleViewConfig();
        config.save(file);
        log.info("Created default config at {}", file);
        return config;
    }
}
