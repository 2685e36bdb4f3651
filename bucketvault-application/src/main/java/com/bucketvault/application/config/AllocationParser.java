package com.bucketvault.application.config;

import com.bucketvault.domain.allocation.AssetWeight;
import com.bucketvault.domain.allocation.TargetAllocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses "ASSET:WEIGHT,ASSET:WEIGHT" into a validated {@link TargetAllocation}.
 */
public final class AllocationParser {

    private AllocationParser() {}

    public static TargetAllocation parse(String value) {
        Objects.requireNonNull(value, "value");
        List<AssetWeight> rows = new ArrayList<>();
        for (String part : value.split(",")) {
            String t = part.trim();
            if (t.isEmpty()) continue;
            int colon = t.indexOf(':');
            if (colon <= 0 || colon == t.length() - 1) {
                throw new IllegalArgumentException("Unsupported allocation row: " + t);
            }
            int weight;
            try {
                weight = Integer.parseInt(t.substring(colon + 1).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Weight is not an integer: " + t, e);
            }
            rows.add(AssetWeight.of(t.substring(0, colon), weight));
        }
        return TargetAllocation.of(rows);
    }

    public static String format(TargetAllocation allocation) {
        StringBuilder sb = new StringBuilder();
        for (AssetWeight row : allocation.rows()) {
            if (sb.length() > 0) sb.append(',');
            sb.append(row.asset()).append(':').append(row.weight());
        }
        return sb.toString();
    }
}
