package io.auditforge.delta;

import io.auditforge.model.DeltaSummary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record DeltaReport(
        String fromRevision,
        String toRevision,
        List<DeltaRecord> records,
        DeltaSummary summary
) {
    public DeltaReport {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean massiveRewrite() {
        return summary != null && summary.massiveRewrite();
    }

    public Optional<DeltaRecord> recordFor(String path) {
        if (path == null) {
            return Optional.empty();
        }
        for (DeltaRecord record : records) {
            if (record.path().equals(path)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    public Map<String, DeltaRecord> byPath() {
        Map<String, DeltaRecord> out = new LinkedHashMap<>();
        for (DeltaRecord record : records) {
            out.put(record.path(), record);
        }
        return out;
    }
}
