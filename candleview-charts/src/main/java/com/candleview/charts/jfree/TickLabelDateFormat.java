package com.candleview.charts.jfree;

import com.candleview.charts.engine.TickLabelFormatter;

import java.text.DateFormat;
import java.text.FieldPosition;
import java.text.ParsePosition;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.Date;
import java.util.TimeZone;
import java.util.function.LongUnaryOperator;

/**
 * Date axis format that delegates tick labels to a {@link TickLabelFormatter}.
 *
 * <p>JFreeChart places ticks on round times, not on bars. Each tick is snapped
 * to the nearest loaded bar first, so boundary checks see real bar times.</p>
 */
class TickLabelDateFormat extends DateFormat {

    private final TickLabelFormatter formatter;
    private final LongUnaryOperator snapToBar;
    private final SimpleDateFormat parseFormat;

    TickLabelDateFormat(TickLabelFormatter formatter, LongUnaryOperator snapToBar) {
        this.formatter = formatter;
        this.snapToBar = snapToBar;

        TimeZone tz = TimeZone.getTimeZone("UTC");
        parseFormat = new SimpleDateFormat("yyyy-MM-dd HH:mm");
        parseFormat.setTimeZone(tz);

        this.calendar = Calendar.getInstance(tz);
        this.numberFormat = parseFormat.getNumberFormat();
    }

    @Override
    public StringBuffer format(Date date, StringBuffer toAppendTo, FieldPosition fieldPosition) {
        long seconds = Math.floorDiv(date.getTime(), 1000L);
        return toAppendTo.append(formatter.format(snapToBar.applyAsLong(seconds)));
    }

    @Override
    public Date parse(String source, ParsePosition pos) {
        return parseFormat.parse(source, pos);
    }
}
