package com.invdash.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Collected records of a snapshot, grouped per host.
 *
 * <p>Hosts are matched on their normalized id while the supplied spelling is kept for output.
 * The VMS layout serializes as {@code {host: [records]}}, the HOSTS layout as a flat list of host
 * records. Replacing a host's records is always wholesale.
 */
@JsonDeserialize(using = SnapshotData.Reader.class)
public final class SnapshotData {
    public static final String REPORTED_HOST = "reported_host";

    private final ScopeName layout;
    private final LinkedHashMap<String, HostRecords> entries = new LinkedHashMap<>();

    private SnapshotData(ScopeName layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public static SnapshotData empty(ScopeName layout) {
        return new SnapshotData(layout);
    }

    public ScopeName getLayout() {
        return layout;
    }

    /**
     * Replaces every record of {@code host} with {@code records}. Records without a host are stamped
     * with the supplied host. An empty list removes the host from the HOSTS layout, which has no way
     * to represent a host without records.
     *
     * <p>The HOSTS layout is regrouped by each record's {@code host} when read back, so there the
     * supplied host id always wins; a different name reported by the collector is kept as
     * {@value #REPORTED_HOST}.
     */
    public void replace(String host, List<InventoryRecord> records) {
        String key = ScopeKey.normalizeHost(host);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("host is required");
        }
        String supplied = host.trim();
        List<InventoryRecord> copies = new ArrayList<>();
        if (records != null) {
            for (InventoryRecord record : records) {
                if (record == null) {
                    continue;
                }
                InventoryRecord copy = record.copy();
                if (copy.getHost() == null || copy.getHost().isBlank()) {
                    copy.setHost(supplied);
                } else if (layout == ScopeName.HOSTS) {
                    if (!ScopeKey.normalizeHost(copy.getHost()).equals(key)) {
                        copy.setAttribute(REPORTED_HOST, copy.getHost());
                    }
                    copy.setHost(supplied);
                }
                copies.add(copy);
            }
        }
        entries.remove(key);
        if (copies.isEmpty() && layout == ScopeName.HOSTS) {
            return;
        }
        entries.put(key, new HostRecords(supplied, copies));
    }

    public Optional<List<InventoryRecord>> recordsFor(String host) {
        HostRecords entry = entries.get(ScopeKey.normalizeHost(host));
        if (entry == null) {
            return Optional.empty();
        }
        List<InventoryRecord> out = new ArrayList<>();
        entry.records.forEach(r -> out.add(r.copy()));
        return Optional.of(out);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int hostCount() {
        return entries.size();
    }

    public int recordCount() {
        return entries.values().stream().mapToInt(e -> e.records.size()).sum();
    }

    public SnapshotData copy() {
        SnapshotData copy = new SnapshotData(layout);
        entries.forEach((key, entry) -> {
            List<InventoryRecord> records = new ArrayList<>();
            entry.records.forEach(r -> records.add(r.copy()));
            copy.entries.put(key, new HostRecords(entry.host, records));
        });
        return copy;
    }

    @JsonValue
    public Object toJson() {
        if (layout == ScopeName.VMS) {
            Map<String, List<InventoryRecord>> byHost = new LinkedHashMap<>();
            entries.values().forEach(e -> byHost.put(e.host, e.records));
            return byHost;
        }
        List<InventoryRecord> flat = new ArrayList<>();
        entries.values().forEach(e -> flat.addAll(e.records));
        return flat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SnapshotData that)) {
            return false;
        }
        return layout == that.layout && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(layout, entries);
    }

    @Override
    public String toString() {
        return "SnapshotData(layout=" + layout + ", hosts=" + entries.size() + ", records=" + recordCount() + ")";
    }

    private static final class HostRecords {
        private final String host;
        private final List<InventoryRecord> records;

        private HostRecords(String host, List<InventoryRecord> records) {
            this.host = host;
            this.records = records;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof HostRecords that)) {
                return false;
            }
            return host.equals(that.host) && records.equals(that.records);
        }

        @Override
        public int hashCode() {
            return Objects.hash(host, records);
        }
    }

    /**
     * Reads either layout back: a JSON object is the VMS layout, an array the HOSTS layout.
     */
    public static final class Reader extends StdDeserializer<SnapshotData> {

        public Reader() {
            super(SnapshotData.class);
        }

        @Override
        public SnapshotData deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            ObjectCodec codec = p.getCodec();
            JsonNode node = codec.readTree(p);
            if (node.isObject()) {
                SnapshotData data = new SnapshotData(ScopeName.VMS);
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    data.replace(field.getKey(), readRecords(codec, field.getValue()));
                }
                return data;
            }
            if (node.isArray()) {
                Map<String, List<InventoryRecord>> grouped = new LinkedHashMap<>();
                Map<String, String> spelling = new LinkedHashMap<>();
                for (InventoryRecord record : readRecords(codec, node)) {
                    String key = ScopeKey.normalizeHost(record.getHost());
                    if (key.isEmpty()) {
                        continue;
                    }
                    spelling.putIfAbsent(key, record.getHost().trim());
                    grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
                }
                SnapshotData data = new SnapshotData(ScopeName.HOSTS);
                grouped.forEach((key, records) -> data.replace(spelling.get(key), records));
                return data;
            }
            return ctxt.reportInputMismatch(SnapshotData.class, "data must be a JSON object or array, got %s", node.getNodeType());
        }

        private static List<InventoryRecord> readRecords(ObjectCodec codec, JsonNode array) throws IOException {
            List<InventoryRecord> records = new ArrayList<>();
            if (array == null || !array.isArray()) {
                return records;
            }
            for (JsonNode element : array) {
                records.add(codec.treeToValue(element, InventoryRecord.class));
            }
            return records;
        }
    }
}
