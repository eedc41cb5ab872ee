package org.opensearch.indexsync.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * How one schema field is declared: a simple value, or an object whose sub-keys carry their own declarations.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class FieldDeclaration {
    private final boolean noIndex;
    private final Map<String, FieldDeclaration> subFields;

    private FieldDeclaration(boolean noIndex, Map<String, FieldDeclaration> subFields) {
        this.noIndex = noIndex;
        this.subFields = subFields == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(subFields));
    }

    public static FieldDeclaration simple() {
        return new FieldDeclaration(false, null);
    }

    public static FieldDeclaration notIndexed() {
        return new FieldDeclaration(true, null);
    }

    public static FieldDeclaration object(Map<String, FieldDeclaration> subFields) {
        return new FieldDeclaration(false, subFields);
    }

    public static FieldDeclaration object(boolean noIndex, Map<String, FieldDeclaration> subFields) {
        return new FieldDeclaration(noIndex, subFields);
    }

    public boolean isObject() {
        return subFields != null;
    }
}
