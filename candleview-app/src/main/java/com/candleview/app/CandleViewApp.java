package com.candleview.app;

import com.candleview.app.data.CandleRepository;
import com.candleview.app.ui.ChartFrame;
import com.formdev.flatlaf.FlatDarkLaf;
import com.formdev.flatlaf.FlatLightLaf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;

/**
 * CandleView - candlestick chart viewer.
 *
 * Reads candles per symbol from the configured data folder
 * (~/.candleview/data by default) and falls back to sample data.
 */
public class CandleViewApp {

    private static final Logger log = LoggerFactory.getLogger(CandleViewApp.class);

    private final CandleViewConfig config;
    private final CandleRepository repository;

    private ChartFrame frame;

    public CandleViewApp(CandleViewConfig config) {
        this.config = config;
        this.repository = new CandleRepository(config.getDataPath());
    }

    /**
     * Start the application.
     */
    public void start() {
        log.info("Starting CandleView, data folder {}", repository.getDataDir());
        installLookAndFeel(config.getLookAndFeel());

        SwingUtilities.invokeLater(() -> {
            frame = new ChartFrame(config, repository);
            frame.setOnClose(this::shutdown);
            frame.setVisible(true);
        });
    }

    private void shutdown() {
        log.info("CandleView shutdown");
        System.exit(0);
    }

    static void installLookAndFeel(String name) {
        try {
            if (CandleViewConfig.LIGHT.equalsIgnoreCase(name)) {
                UIManager.setLookAndFeel(new FlatLightLaf());
            } else {
                UIManager.setLookAndFeel(new FlatDarkLaf());
            }
        } catch (UnsupportedLookAndFeelException e) {
            log.warn("Failed to set look and feel: {}", e.getMessage());
        }
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        log.info("CandleView v1.0");

        CandleViewApp app = new CandleViewApp(CandleViewConfig.load());
        app.start();
    }
}
