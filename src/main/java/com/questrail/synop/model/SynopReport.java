package com.questrail.synop.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * SynopReport
 * =============================================================================
 * Immutable result of decoding one SYNOP telegram, and the input to encoding.
 *
 * <h2>Shape</h2>
 * <ul>
 *   <li>A typed map from {@link SynopField} to value. An absent key means the
 *       group was not present in the report; a present key holding an
 *       unavailable {@link Observation} means the group was present but its
 *       value was reported as {@code /}.</li>
 *   <li>A {@code nil} flag for reports terminated by {@code NIL} after
 *       section 0.</li>
 *   <li>An open list of raw groups that were recognised as belonging to the
 *       report but are not decoded. Reports with entries here cannot be
 *       re-encoded to the identical telegram.</li>
 * </ul>
 *
 * <p>Instances are built with {@link Builder}; the builder is the only mutable
 * piece and is confined to a single decode call.</p>
 */
public final class SynopReport
{
    private final Map<SynopField<?>, Object> fields;
    private final boolean nil;
    private final List<String> notImplemented;

    private SynopReport(Map<SynopField<?>, Object> fields, boolean nil, List<String> notImplemented) {
        this.fields = fields;
        this.nil = nil;
        this.notImplemented = notImplemented;
    }

    public static Builder builder() {
        return new Builder();
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(SynopField<T> field) {
        Objects.requireNonNull(field, "field");
        return Optional.ofNullable((T) fields.get(field));
    }

    public boolean has(SynopField<?> field) {
        return fields.containsKey(field);
    }

    /**
     * Present fields in encode order.
     */
    public List<SynopField<?>> fields() {
        return List.copyOf(fields.keySet());
    }

    public boolean hasSection(int section) {
        return fields.keySet().stream().anyMatch(f -> f.section() == section);
    }

    public boolean isNil() {
        return nil;
    }

    public List<String> notImplemented() {
        return notImplemented;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.fields.putAll(fields);
        builder.nil = nil;
        builder.notImplemented.addAll(notImplemented);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SynopReport other)) return false;
        return nil == other.nil
            && fields.equals(other.fields)
            && notImplemented.equals(other.notImplemented);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, nil, notImplemented);
    }

    @Override
    public String toString() {
        return "SynopReport" + fields + (nil ? " NIL" : "")
            + (notImplemented.isEmpty() ? "" : " notImplemented=" + notImplemented);
    }

    public static final class Builder
    {
        private final Map<SynopField<?>, Object> fields =
                new TreeMap<>(Comparator.comparingInt(SynopField::ordinal));
        private final List<String> notImplemented = new ArrayList<>();
        private boolean nil;

        private Builder() {}

        public <T> Builder put(SynopField<T> field, T value) {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
            fields.put(field, value);
            return this;
        }

        public Builder remove(SynopField<?> field) {
            fields.remove(field);
            return this;
        }

        public boolean has(SynopField<?> field) {
            return fields.containsKey(field);
        }

        @SuppressWarnings("unchecked")
        public <T> Optional<T> get(SynopField<T> field) {
            return Optional.ofNullable((T) fields.get(field));
        }

        /**
         * Appends to a repeatable field, creating the list on first use.
         */
        @SuppressWarnings("unchecked")
        public <E> Builder append(SynopField<List<E>> field, E element) {
            Objects.requireNonNull(element, "element");
            List<E> list = (List<E>) fields.computeIfAbsent(field, f -> new ArrayList<E>());
            list.add(element);
            return this;
        }

        public Builder nil(boolean nil) {
            this.nil = nil;
            return this;
        }

        public Builder notImplemented(String group) {
            notImplemented.add(Objects.requireNonNull(group, "group"));
            return this;
        }

        public SynopReport build() {
            Map<SynopField<?>, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<SynopField<?>, Object> entry : fields.entrySet()) {
                Object value = entry.getValue();
                copy.put(entry.getKey(), value instanceof List<?> list ? List.copyOf(list) : value);
            }
            return new SynopReport(
                    Collections.unmodifiableMap(copy),
                    nil,
                    List.copyOf(notImplemented));
        }
    }
}
