package com.sparrowlogic.networktopology.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loosely typed record batches of one snapshot, exactly as the provider's describe calls return
 * them. Absent batches read as empty.
 */
public final class RawSnapshot {

    private final String accountId;
    private final Map<ResourceKind, List<Map<String, Object>>> batches = new EnumMap<>(ResourceKind.class);
    private final Map<TableDetail, Map<String, List<Map<String, Object>>>> tableDetails = new EnumMap<>(TableDetail.class);

    public RawSnapshot(String accountId) {
        this.accountId = accountId != null ? accountId : "";
    }

    public String accountId() {
        return accountId;
    }

    public RawSnapshot add(ResourceKind kind, List<Map<String, Object>> records) {
        batches.computeIfAbsent(kind, k -> new ArrayList<>()).addAll(records);
        return this;
    }

    public RawSnapshot addTableDetail(TableDetail detail, String routeTableId, List<Map<String, Object>> records) {
        tableDetails.computeIfAbsent(detail, k -> new LinkedHashMap<>())
            .computeIfAbsent(routeTableId, k -> new ArrayList<>())
            .addAll(records);
        return this;
    }

    public List<Map<String, Object>> batch(ResourceKind kind) {
        return Collections.unmodifiableList(batches.getOrDefault(kind, List.of()));
    }

    /**
     * Records of one detail type keyed by the route table they were exported for.
     */
    public Map<String, List<Map<String, Object>>> tableDetails(TableDetail detail) {
        return Collections.unmodifiableMap(tableDetails.getOrDefault(detail, Map.of()));
    }

    public int recordCount() {
        var count = batches.values().stream().mapToInt(List::size).sum();
        for (var byTable : tableDetails.values()) {
            count += byTable.values().stream().mapToInt(List::size).sum();
        }
        return count;
    }
}
