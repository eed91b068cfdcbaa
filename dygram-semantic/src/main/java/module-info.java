module dev.mars.dygram.semantic {
    requires transitive dev.mars.dygram.core;
    requires org.slf4j;
    requires org.yaml.snakeyaml;
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;

    exports dev.mars.dygram.semantic;
    exports dev.mars.dygram.semantic.dependency;
    exports dev.mars.dygram.semantic.expand;
    exports dev.mars.dygram.semantic.graph;
    exports dev.mars.dygram.semantic.io;
    exports dev.mars.dygram.semantic.link;
    exports dev.mars.dygram.semantic.nodes;
    exports dev.mars.dygram.semantic.scope;
    exports dev.mars.dygram.semantic.template;
    exports dev.mars.dygram.semantic.types;
}
