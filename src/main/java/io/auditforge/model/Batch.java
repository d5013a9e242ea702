package io.auditforge.model;

import java.util.List;

public record Batch(
        int number,
        int size,
        List<String> itemIds
) {
    public Batch {
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
    }
}
