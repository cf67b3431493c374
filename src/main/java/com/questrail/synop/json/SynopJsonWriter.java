package com.questrail.synop.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.synop.model.Observation;
import com.questrail.synop.model.Quantifier;
import com.questrail.synop.model.Region;
import com.questrail.synop.model.SynopField;
import com.questrail.synop.model.SynopReport;

import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.List;

/**
 * SynopJsonWriter
 * -----------------------------------------------------------------------------
 * Renders a {@link SynopReport} as a JSON tree with snake_case keys.
 *
 * <h2>Shape</h2>
 * <ul>
 *   <li>Each present field becomes a member named after
 *       {@link SynopField#name()}.</li>
 *   <li>An available {@link Observation} becomes an object. A scalar value is
 *       written as {@code value}; a structured value has its components
 *       written inline. {@code unit}, {@code _table} and {@code _code} follow
 *       when set.</li>
 *   <li>An unavailable observation is written as {@code null}.</li>
 *   <li>{@code null} components and {@code false} flags are left out.</li>
 *   <li>Groups kept verbatim are listed under {@code _not_implemented}.</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class SynopJsonWriter
{
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper mapper;

    public SynopJsonWriter() {
        this(false);
    }

    public SynopJsonWriter(boolean indent) {
        ObjectMapper m = new ObjectMapper();
        this.mapper = indent ? m.enable(SerializationFeature.INDENT_OUTPUT) : m;
    }

    public String write(SynopReport report) {
        try {
            return mapper.writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render SYNOP report", e);
        }
    }

    public ObjectNode toTree(SynopReport report) {
        ObjectNode root = NODES.objectNode();
        for (SynopField<?> field : report.fields()) {
            report.get(field).ifPresent(value -> root.set(field.name(), toNode(value)));
        }
        if (report.isNil()) {
            root.put("nil", true);
        }
        if (!report.notImplemented().isEmpty()) {
            ArrayNode groups = root.putArray("_not_implemented");
            report.notImplemented().forEach(groups::add);
        }
        return root;
    }

    private static JsonNode toNode(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof Observation<?> observation) {
            return observationNode(observation);
        }
        if (value instanceof List<?> list) {
            ArrayNode array = NODES.arrayNode();
            list.forEach(element -> array.add(toNode(element)));
            return array;
        }
        if (value instanceof Record record) {
            ObjectNode node = NODES.objectNode();
            writeComponents(record, node);
            return node;
        }
        return scalarNode(value);
    }

    private static JsonNode observationNode(Observation<?> observation) {
        if (!observation.available()) {
            return NODES.nullNode();
        }
        ObjectNode node = NODES.objectNode();
        if (observation.value() instanceof Record record) {
            writeComponents(record, node);
        } else {
            node.set("value", scalarNode(observation.value()));
        }
        if (observation.unit() != null) {
            node.put("unit", observation.unit());
        }
        if (observation.table() != null) {
            node.put("_table", observation.table());
        }
        if (observation.code() != null) {
            node.put("_code", observation.code());
        }
        return node;
    }

    private static void writeComponents(Record record, ObjectNode node) {
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Object value;
            try {
                value = component.getAccessor().invoke(record);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new IllegalStateException("Cannot read " + component.getName() + " of " + record, e);
            }
            if (value == null || Boolean.FALSE.equals(value)) {
                continue;
            }
            node.set(snakeCase(component.getName()), toNode(value));
        }
    }

    private static JsonNode scalarNode(Object value) {
        if (value instanceof Integer i) {
            return NODES.numberNode(i);
        }
        if (value instanceof Long l) {
            return NODES.numberNode(l);
        }
        if (value instanceof Double d) {
            return NODES.numberNode(d);
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Quantifier q) {
            return NODES.textNode(q.label());
        }
        if (value instanceof Region r) {
            return NODES.textNode(r.label());
        }
        if (value instanceof Enum<?> e) {
            return NODES.textNode(e.name());
        }
        if (value instanceof Record || value instanceof List<?>) {
            return toNode(value);
        }
        return NODES.textNode(value.toString());
    }

    static String snakeCase(String camelCase) {
        StringBuilder out = new StringBuilder(camelCase.length() + 4);
        for (int i = 0; i < camelCase.length(); i++) {
            char c = camelCase.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
