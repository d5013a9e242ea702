package io.auditforge.budget;

import io.auditforge.model.Finding;
import io.auditforge.model.FindingStatus;
import io.auditforge.model.SynthesisMode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds the input of a synthesis worker for the selected mode.
 *
 * <p>NOT_VULNERABLE findings are always collapsed to id, status and a one-line summary.
 */
public final class SynthesisInputPlanner {
    static final int ONE_LINE_CHARS = 160;

    public SynthesisInput plan(SynthesisMode mode, long totalEstimate, Collection<Finding> findings,
                               Collection<Path> references) {
        List<SynthesisInput.FindingDigest> digests = new ArrayList<>();
        for (Finding finding : findings) {
            digests.add(digest(mode, finding));
        }
        List<SynthesisInput.ReferenceDoc> docs = new ArrayList<>();
        for (Path reference : references) {
            String content = mode == SynthesisMode.INLINE ? readOrNull(reference) : null;
            docs.add(new SynthesisInput.ReferenceDoc(reference.toString(), content));
        }
        return new SynthesisInput(mode, totalEstimate, digests, docs);
    }

    SynthesisInput.FindingDigest digest(SynthesisMode mode, Finding finding) {
        String summary = oneLine(finding.summary() == null ? finding.title() : finding.summary());
        if (finding.status() == FindingStatus.NOT_VULNERABLE) {
            return new SynthesisInput.FindingDigest(finding.id(), finding.status(), null, null, summary,
                    null, null, true);
        }
        String fullDetail = finding.detailPath() == null ? null : readOrNull(Path.of(finding.detailPath()));
        if (fullDetail == null) {
            fullDetail = finding.summary();
        }
        String detail;
        String detailPath;
        if (mode == SynthesisMode.DISK_HEAVY) {
            detail = firstParagraph(fullDetail);
            detailPath = finding.detailPath();
        } else {
            detail = fullDetail;
            detailPath = null;
        }
        return new SynthesisInput.FindingDigest(finding.id(), finding.status(), finding.severity(),
                finding.targetFile(), summary, detail, detailPath, false);
    }

    static String oneLine(String raw) {
        if (raw == null) {
            return "";
        }
        String line = raw.strip();
        int newline = line.indexOf('\n');
        if (newline >= 0) {
            line = line.substring(0, newline).strip();
        }
        return line.length() <= ONE_LINE_CHARS ? line : line.substring(0, ONE_LINE_CHARS) + "...";
    }

    static String firstParagraph(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.strip().replace("\r\n", "\n");
        int end = text.indexOf("\n\n");
        return end < 0 ? text : text.substring(0, end).strip();
    }

    private static String readOrNull(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return null;
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read synthesis reference: " + path, e);
        }
    }
}
