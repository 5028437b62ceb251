package com.invdash.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One collected inventory record (a VM or a host summary).
 *
 * <p>{@code provider} and {@code host} are typed; everything else the collector returns lives in
 * {@link #getAttributes()} and is flattened into the record's JSON object.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InventoryRecord {
    private static final String HOST = "host";
    private static final String PROVIDER = "provider";

    private String provider;
    private String host;

    @Setter(AccessLevel.NONE)
    private Map<String, Object> attributes = new LinkedHashMap<>();

    /**
     * Builds a record from a loosely typed map. {@code host} and {@code provider} entries are lifted
     * into the typed fields.
     */
    public static InventoryRecord of(String host, Map<String, ?> values) {
        InventoryRecord record = new InventoryRecord();
        record.setHost(host);
        if (values != null) {
            values.forEach(record::setAttribute);
        }
        return record;
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String name, Object value) {
        if (HOST.equals(name)) {
            host = value == null ? null : value.toString();
        } else if (PROVIDER.equals(name)) {
            provider = value == null ? null : value.toString();
        } else {
            attributes.put(name, value);
        }
    }

    public Object get(String name) {
        return attributes.get(name);
    }

    public InventoryRecord copy() {
        InventoryRecord copy = new InventoryRecord();
        copy.setProvider(provider);
        copy.setHost(host);
        attributes.forEach((k, v) -> copy.attributes.put(k, deepCopy(v)));
        return copy;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(k, deepCopy(v)));
            return out;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            collection.forEach(v -> out.add(deepCopy(v)));
            return out;
        }
        return value;
    }
}
