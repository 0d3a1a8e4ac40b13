package com.candleview.app.ui;

import com.candleview.app.CandleViewConfig;
import com.candleview.app.data.CandleRepository;
import com.candleview.charts.core.CandlestickChartBinding;
import com.candleview.charts.core.ViewState;
import com.candleview.charts.jfree.ChartPanelFactory;
import com.candleview.charts.jfree.JFreeChartEngine;
import com.candleview.charts.jfree.SwingChartContainer;
import com.candleview.core.model.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import java.awt.*;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.IOException;
import java.util.List;

/**
 * Main window: a symbol toolbar above one candlestick chart.
 * The chart is mounted when the window opens and unmounted when it closes.
 */
public class ChartFrame extends JFrame {

    private static final Logger log = LoggerFactory.getLogger(ChartFrame.class);

    private static final String CHART_CARD = "chart";
    private static final String EMPTY_CARD = "empty";

    private final CandleRepository repository;
    private final CandlestickChartBinding binding;

    private final JComboBox<String> symbolCombo;
    private final JLabel crosshairLabel;
    private final JPanel chartHost;
    private final JPanel cards;
    private final CardLayout cardLayout;

    private Runnable onClose;

    public ChartFrame(CandleViewConfig config, CandleRepository repository) {
        super("CandleView");
        this.repository = repository;
        setDefaultCloseOperation(JFrame.DO_NOTHING_ON_CLOSE);

        JFreeChartEngine engine = new JFreeChartEngine(panel -> ChartPanelFactory.installPopupMenu(panel, this::resetView));
        binding = new CandlestickChartBinding(engine, config.getChart());
        binding.setOnViewStateChange(this::applyViewState);

        symbolCombo = new JComboBox<>(config.getSymbols().toArray(new String[0]));
        symbolCombo.setSelectedItem(config.getInitialSymbol());
        symbolCombo.addActionListener(e -> loadSelectedSymbol());

        JButton resetButton = new JButton("Reset View");
        resetButton.setToolTipText("Fit all candles and autoscale prices");
        resetButton.addActionListener(e -> resetView());

        crosshairLabel = new JLabel(" ");
        crosshairLabel.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 12));

        JToolBar toolbar = new JToolBar();
        toolbar.setFloatable(false);
        toolbar.add(symbolCombo);
        toolbar.addSeparator();
        toolbar.add(resetButton);
        toolbar.add(Box.createHorizontalGlue());
        toolbar.add(crosshairLabel);

        chartHost = new JPanel(new BorderLayout());

        JLabel emptyLabel = new JLabel("No data", SwingConstants.CENTER);
        emptyLabel.setForeground(UIManager.getColor("Label.disabledForeground"));

        cardLayout = new CardLayout();
        cards = new JPanel(cardLayout);
        cards.add(chartHost, CHART_CARD);
        cards.add(emptyLabel, EMPTY_CARD);
        cardLayout.show(cards, EMPTY_CARD);

        JPanel mainPanel = new JPanel(new BorderLayout(0, 0));
        mainPanel.add(toolbar, BorderLayout.NORTH);
        mainPanel.add(cards, BorderLayout.CENTER);
        setContentPane(mainPanel);

        cards.setPreferredSize(new Dimension(1000, config.getChart().getHeight()));
        pack();
        setLocationRelativeTo(null);

        addWindowListener(new WindowAdapter() {
            @Override
            public void windowOpened(WindowEvent e) {
                if (binding.mount(new SwingChartContainer(chartHost))) {
                    loadSelectedSymbol();
                }
            }

            @Override
            public void windowClosing(WindowEvent e) {
                binding.unmount();
                if (onClose != null) {
                    onClose.run();
                }
                dispose();
            }
        });
    }

    public void setOnClose(Runnable onClose) {
        this.onClose = onClose;
    }

    public CandlestickChartBinding getBinding() {
        return binding;
    }

    private void loadSelectedSymbol() {
        String symbol = (String) symbolCombo.getSelectedItem();
        if (symbol == null) return;

        try {
            List<Candle> candles = repository.load(symbol);
            binding.update(candles, symbol);
        } catch (IOException e) {
            log.error("Failed to load candles for {}: {}", symbol, e.getMessage());
            binding.update(List.of(), symbol);
            JOptionPane.showMessageDialog(this,
                "Could not load " + symbol + ":\n" + e.getMessage(),
                "Load Failed", JOptionPane.ERROR_MESSAGE);
        }
    }

    private void resetView() {
        binding.resetView();
    }

    private void applyViewState(ViewState state) {
        cardLayout.show(cards, state.hasData() ? CHART_CARD : EMPTY_CARD);
        crosshairLabel.setText(state.crosshairTime() != null ? state.crosshairTime() : " ");
    }
}
