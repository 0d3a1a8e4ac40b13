module com.candleview.charts {
    // Exports - all packages
    exports com.candleview.charts.engine;
    exports com.candleview.charts.core;
    exports com.candleview.charts.config;
    exports com.candleview.charts.util;
    exports com.candleview.charts.jfree;

    // Required modules
    requires transitive com.candleview.core;
    requires transitive org.jfree.jfreechart;
    requires transitive java.desktop;
    requires org.slf4j;

    // Config is bound by Jackson in the app
    opens com.candleview.charts.config;
}
