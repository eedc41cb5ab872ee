package org.opensearch.indexsync.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Ordered field declarations of one collection. Immutable.
 */
@EqualsAndHashCode
@ToString
public final class SchemaDescriptor {
    public static final SchemaDescriptor EMPTY = new SchemaDescriptor(Map.of());

    private final Map<String, FieldDeclaration> fields;

    public SchemaDescriptor(Map<String, FieldDeclaration> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, FieldDeclaration> getFields() {
        return fields;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, FieldDeclaration> fields = new LinkedHashMap<>();

        public Builder field(String name) {
            return field(name, FieldDeclaration.simple());
        }

        public Builder field(String name, FieldDeclaration declaration) {
            fields.put(name, declaration);
            return this;
        }

        public Builder notIndexed(String name) {
            return field(name, FieldDeclaration.notIndexed());
        }

        public SchemaDescriptor build() {
            return new SchemaDescriptor(fields);
        }
    }
}
