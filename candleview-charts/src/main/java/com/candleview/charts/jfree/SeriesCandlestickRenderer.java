package com.candleview.charts.jfree;

import com.candleview.charts.engine.SeriesOptions;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.CandlestickRenderer;
import org.jfree.data.xy.OHLCDataset;
import org.jfree.data.xy.XYDataset;

import java.awt.Color;
import java.awt.Paint;

/**
 * Candlestick renderer that draws wicks in their own up/down colors.
 * Bodies use the up/down paints, outlines follow {@link SeriesOptions#borderVisible()}.
 */
class SeriesCandlestickRenderer extends CandlestickRenderer {

    private final Color wickUpColor;
    private final Color wickDownColor;

    SeriesCandlestickRenderer(SeriesOptions options) {
        super();
        this.wickUpColor = options.wickUpColor();
        this.wickDownColor = options.wickDownColor();
        setUpPaint(options.upColor());
        setDownPaint(options.downColor());
        setUseOutlinePaint(options.borderVisible());
        setDrawVolume(false);
        setAutoWidthMethod(WIDTHMETHOD_SMALLEST);
    }

    @Override
    public Paint getItemPaint(int row, int column) {
        XYPlot plot = getPlot();
        XYDataset ds = plot != null ? plot.getDataset(plot.getIndexOf(this)) : null;
        if (ds instanceof OHLCDataset ohlc && column < ohlc.getItemCount(row)) {
            double open = ohlc.getOpenValue(row, column);
            double close = ohlc.getCloseValue(row, column);
            return close >= open ? wickUpColor : wickDownColor;
        }
        return wickDownColor;
    }
}
