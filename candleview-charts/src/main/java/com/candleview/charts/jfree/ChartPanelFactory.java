package com.candleview.charts.jfree;

import org.jfree.chart.ChartPanel;
import org.jfree.chart.JFreeChart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.JMenuItem;
import javax.swing.JPopupMenu;
import java.awt.Dimension;
import java.io.IOException;

/**
 * Factory for creating consistently configured chart panels.
 */
public final class ChartPanelFactory {

    private static final Logger log = LoggerFactory.getLogger(ChartPanelFactory.class);

    private ChartPanelFactory() {} // Prevent instantiation

    /**
     * Create a ChartPanel with the given preferred size.
     * No default popup menu is built; see {@link #installPopupMenu}.
     */
    public static ChartPanel create(JFreeChart chart, int width, int height) {
        ChartPanel panel = new ChartPanel(chart,
            width, height,
            0, 0,
            Integer.MAX_VALUE, Integer.MAX_VALUE,
            true,
            false, false, false, false, false,
            false);
        configure(panel);
        panel.setPreferredSize(new Dimension(width, height));
        return panel;
    }

    /**
     * Configure an existing ChartPanel with standard settings.
     */
    public static void configure(ChartPanel panel) {
        // Wheel zooms the time axis, ctrl-drag pans; price axis follows autoscale
        panel.setMouseWheelEnabled(true);
        panel.setDomainZoomable(true);
        panel.setRangeZoomable(false);

        // Allow drawing at any size
        panel.setMinimumDrawWidth(0);
        panel.setMinimumDrawHeight(0);
        panel.setMaximumDrawWidth(Integer.MAX_VALUE);
        panel.setMaximumDrawHeight(Integer.MAX_VALUE);

        // Remove border
        panel.setBorder(null);
    }

    /**
     * Install the simplified context menu.
     *
     * @param onResetView invoked by the "Reset View" item
     */
    public static void installPopupMenu(ChartPanel panel, Runnable onResetView) {
        JPopupMenu popup = new JPopupMenu();

        JMenuItem resetView = new JMenuItem("Reset View");
        resetView.addActionListener(e -> onResetView.run());
        popup.add(resetView);

        popup.addSeparator();

        JMenuItem fitHorizontal = new JMenuItem("Fit Horizontal");
        fitHorizontal.addActionListener(e -> panel.restoreAutoDomainBounds());
        popup.add(fitHorizontal);

        JMenuItem fitVertical = new JMenuItem("Fit Vertical");
        fitVertical.addActionListener(e -> panel.restoreAutoRangeBounds());
        popup.add(fitVertical);

        popup.addSeparator();

        JMenuItem copyImage = new JMenuItem("Copy");
        copyImage.addActionListener(e -> panel.doCopy());
        popup.add(copyImage);

        JMenuItem saveAs = new JMenuItem("Save As...");
        saveAs.addActionListener(e -> {
            try {
                panel.doSaveAs();
            } catch (IOException ex) {
                log.warn("Failed to save chart image: {}", ex.getMessage());
            }
        });
        popup.add(saveAs);

        panel.setPopupMenu(popup);
    }
}
