package io.auditforge.budget;

import io.auditforge.model.FindingStatus;
import io.auditforge.model.Severity;
import io.auditforge.model.SynthesisMode;

import java.util.List;

public record SynthesisInput(
        SynthesisMode mode,
        long totalEstimate,
        List<FindingDigest> findings,
        List<ReferenceDoc> references
) {
    public SynthesisInput {
        findings = findings == null ? List.of() : List.copyOf(findings);
        references = references == null ? List.of() : List.copyOf(references);
    }

    /**
     * {@code detail} is embedded content; {@code detailPath} is set when the worker must read it itself.
     */
    public record FindingDigest(
            String id,
            FindingStatus status,
            Severity severity,
            String targetFile,
            String summary,
            String detail,
            String detailPath,
            boolean collapsed
    ) {
    }

    public record ReferenceDoc(
            String path,
            String content
    ) {
    }
}
