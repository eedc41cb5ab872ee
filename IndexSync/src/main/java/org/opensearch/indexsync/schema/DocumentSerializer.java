package org.opensearch.indexsync.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.opensearch.indexsync.common.SerializationException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a {@link PrimaryRecord} into the JSON body of its index document. Only selected fields are written,
 * references are flattened to their ids and embedded records to their plain field values.
 */
@Slf4j
public class DocumentSerializer {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public IndexDocument toIndexDocument(PrimaryRecord record, Set<String> fieldSet, String index, String type) {
        return new IndexDocument(index, type, record.getId(), serialize(record, fieldSet));
    }

    /**
     * @throws SerializationException if a selected field holds a value with no JSON representation
     */
    public ObjectNode serialize(PrimaryRecord record, Set<String> fieldSet) {
        var body = NODES.objectNode();
        for (var fieldName : fieldSet) {
            if (!record.has(fieldName)) {
                continue;
            }
            try {
                body.set(fieldName, toJson(record.get(fieldName)));
            } catch (SerializationException e) {
                throw new SerializationException(
                    "Field '" + fieldName + "' of record " + record.getId() + " cannot be indexed: " + e.getMessage(), e);
            }
        }
        log.atTrace().setMessage("Serialized record {} to {}").addArgument(record::getId).addArgument(body).log();
        return body;
    }

    JsonNode toJson(Object value) {
        if (value == null) {
            return NODES.nullNode();
        } else if (value instanceof JsonNode) {
            return ((JsonNode) value).deepCopy();
        } else if (value instanceof CharSequence || value instanceof Character || value instanceof UUID) {
            return NODES.textNode(value.toString());
        } else if (value instanceof Boolean) {
            return NODES.booleanNode((Boolean) value);
        } else if (value instanceof Number) {
            return numberNode((Number) value);
        } else if (value instanceof Enum) {
            return NODES.textNode(((Enum<?>) value).name());
        } else if (value instanceof Date) {
            return NODES.textNode(((Date) value).toInstant().toString());
        } else if (value instanceof TemporalAccessor) {
            return NODES.textNode(value.toString());
        } else if (value instanceof byte[]) {
            return NODES.binaryNode((byte[]) value);
        } else if (value instanceof RecordReference) {
            return toJson(((RecordReference) value).getReferencedId());
        } else if (value instanceof PrimaryRecord) {
            return embedded((PrimaryRecord) value);
        } else if (value instanceof Map) {
            return mapNode((Map<?, ?>) value);
        } else if (value instanceof Collection) {
            return arrayNode((Collection<?>) value);
        } else if (value instanceof Object[]) {
            return arrayNode(Arrays.asList((Object[]) value));
        }
        throw new SerializationException("unsupported value type " + value.getClass().getName());
    }

    private JsonNode numberNode(Number number) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return NODES.numberNode(number.intValue());
        } else if (number instanceof Long) {
            return NODES.numberNode(number.longValue());
        } else if (number instanceof Float) {
            return NODES.numberNode(number.floatValue());
        } else if (number instanceof Double) {
            return NODES.numberNode(number.doubleValue());
        } else if (number instanceof BigDecimal) {
            return NODES.numberNode((BigDecimal) number);
        } else if (number instanceof BigInteger) {
            return NODES.numberNode((BigInteger) number);
        }
        throw new SerializationException("unsupported number type " + number.getClass().getName());
    }

    private ObjectNode embedded(PrimaryRecord record) {
        var node = NODES.objectNode();
        record.getFields().forEach((key, value) -> node.set(key, toJson(value)));
        return node;
    }

    private ObjectNode mapNode(Map<?, ?> map) {
        var node = NODES.objectNode();
        for (var entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new SerializationException("map keys must be strings, found " + entry.getKey());
            }
            node.set((String) entry.getKey(), toJson(entry.getValue()));
        }
        return node;
    }

    private ArrayNode arrayNode(Collection<?> values) {
        var node = NODES.arrayNode();
        for (var v : values) {
            node.add(toJson(v));
        }
        return node;
    }
}
