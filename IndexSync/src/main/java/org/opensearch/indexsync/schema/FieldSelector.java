package org.opensearch.indexsync.schema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides which top-level fields of a schema end up in the search index.
 */
public final class FieldSelector {

    private FieldSelector() {}

    /**
     * A simple field is selected unless it is flagged no-index. An object field is selected unless it is flagged
     * itself, or every one of its sub-keys is flagged; a single unflagged sub-key keeps it searchable.
     *
     * @return selected field names in declaration order
     */
    public static Set<String> selectFields(SchemaDescriptor schema) {
        var selected = new LinkedHashSet<String>();
        schema.getFields().forEach((name, declaration) -> {
            if (isIndexed(declaration)) {
                selected.add(name);
            }
        });
        return Collections.unmodifiableSet(selected);
    }

    static boolean isIndexed(FieldDeclaration declaration) {
        if (declaration.isNoIndex()) {
            return false;
        }
        if (!declaration.isObject()) {
            return true;
        }
        var subFields = declaration.getSubFields().values();
        // an object with no sub-keys has nothing that could veto it
        return subFields.isEmpty() || !subFields.stream().allMatch(FieldDeclaration::isNoIndex);
    }
}
