module io.github.cyfko.elementql.core {
    requires java.logging;

    exports io.github.cyfko.elementql.core;
    exports io.github.cyfko.elementql.core.api;
    exports io.github.cyfko.elementql.core.chain;
    exports io.github.cyfko.elementql.core.config;
    exports io.github.cyfko.elementql.core.exception;
    exports io.github.cyfko.elementql.core.memory;
    exports io.github.cyfko.elementql.core.model;
    exports io.github.cyfko.elementql.core.registry;
    exports io.github.cyfko.elementql.core.rule;
    exports io.github.cyfko.elementql.core.spi;
}
