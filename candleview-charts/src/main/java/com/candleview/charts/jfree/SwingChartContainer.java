package com.candleview.charts.jfree;

import com.candleview.charts.engine.ChartContainer;
import com.candleview.charts.engine.Subscription;

import javax.swing.JComponent;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.ComponentListener;
import java.util.Objects;

/**
 * Chart container backed by a Swing component.
 * The component is considered attached once it is displayable.
 */
public class SwingChartContainer implements ChartContainer {

    private final JComponent host;

    public SwingChartContainer(JComponent host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    public JComponent getHost() {
        return host;
    }

    @Override
    public int getWidth() {
        return host.getWidth();
    }

    @Override
    public boolean isAttached() {
        return host.isDisplayable();
    }

    @Override
    public Subscription addResizeListener(Runnable onResize) {
        ComponentListener listener = new ComponentAdapter() {
            @Override
            public void componentResized(ComponentEvent e) {
                onResize.run();
            }
        };
        host.addComponentListener(listener);
        return () -> host.removeComponentListener(listener);
    }
}
