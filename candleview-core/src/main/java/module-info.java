module com.candleview.core {
    // Exports - all public packages
    exports com.candleview.core.model;
    exports com.candleview.core.time;

    // Jackson (for model serialization)
    requires transitive com.fasterxml.jackson.databind;
    requires transitive com.fasterxml.jackson.annotation;

    // Jackson needs reflection access to models
    opens com.candleview.core.model to com.fasterxml.jackson.databind;
}
