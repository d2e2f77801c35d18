module io.github.cyfko.elementql.jpa {
    requires io.github.cyfko.elementql.core;
    requires jakarta.persistence;
    requires java.logging;

    exports io.github.cyfko.elementql.jpa;

    // field access to ElementEntity, ParameterValue and CategoryEntity
    opens io.github.cyfko.elementql.jpa;
}
