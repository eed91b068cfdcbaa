module dev.mars.dygram.core {
    requires org.slf4j;

    // Public API exports
    exports dev.mars.dygram.ast;
    exports dev.mars.dygram.config;
    exports dev.mars.dygram.core.exceptions;
    exports dev.mars.dygram.validation;
}
