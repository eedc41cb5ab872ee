package org.opensearch.indexsync.pipeline;

import java.util.Set;

import org.opensearch.indexsync.common.ConnectionOptions;
import org.opensearch.indexsync.schema.FieldSelector;
import org.opensearch.indexsync.schema.SchemaDescriptor;

import lombok.Getter;
import lombok.ToString;

/**
 * A collection of the primary store that is mirrored into the search index. The searchable field set is derived
 * from the schema once, here, and reused for every document.
 */
@Getter
@ToString
public class IndexedCollection {
    private final String name;
    private final SchemaDescriptor schema;
    /** Per-collection options; they win over the process-wide defaults. */
    private final ConnectionOptions options;
    private final Set<String> fieldSet;

    public IndexedCollection(String name, SchemaDescriptor schema) {
        this(name, schema, ConnectionOptions.EMPTY);
    }

    public IndexedCollection(String name, SchemaDescriptor schema, ConnectionOptions options) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("A collection needs a name");
        }
        this.name = name;
        this.schema = schema;
        this.options = options == null ? ConnectionOptions.EMPTY : options;
        this.fieldSet = FieldSelector.selectFields(schema);
    }
}
