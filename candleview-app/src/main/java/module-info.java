module com.candleview.app {
    // Internal modules
    requires com.candleview.charts;

    // UI
    requires java.desktop;
    requires com.formdev.flatlaf;

    // Data/IO
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.dataformat.yaml;

    // Logging
    requires org.slf4j;

    exports com.candleview.app;

    // Jackson reflection access
    opens com.candleview.app to com.fasterxml.jackson.databind;
}
