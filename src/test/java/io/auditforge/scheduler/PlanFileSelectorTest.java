package io.auditforge.scheduler;

import io.auditforge.coverage.DeclaredScope;
import io.auditforge.model.Phase;
import io.auditforge.model.WorkItem;
import io.auditforge.model.WorkItemStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class PlanFileSelectorTest {

    @Test
    void planFileProvidesItemsAndDeclaredScope() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-plan-");
        try {
            Path plan = root.resolve("plan.json");
            Files.writeString(plan, """
                    {
                      "items": [
                        {"id": "auth", "scope": ["src/Auth.java", "src/Session.java"], "patterns": ["P-INJ"]},
                        {"id": "api", "worker": "fail", "scope": ["src/Api.java"], "checklist": ["C-1"], "output": "custom/api.md"}
                      ],
                      "scope": {
                        "units": [{"id": "src/Auth.java", "externallyReachable": true}, {"id": "src/Util.java"}],
                        "patterns": [{"id": "P-INJ", "highRisk": true}],
                        "checklist": ["C-1", "C-2"]
                      }
                    }
                    """, StandardCharsets.UTF_8);

            PlanFileSelector selector = PlanFileSelector.load(plan);
            List<WorkItem> items = selector.selectWorkItems(Phase.ANALYZE, null);

            Assertions.assertEquals(2, items.size());
            WorkItem auth = items.get(0);
            Assertions.assertEquals(Phase.ANALYZE, auth.phase());
            Assertions.assertNull(auth.workerClass());
            Assertions.assertEquals(WorkItemStatus.QUEUED, auth.status());
            Assertions.assertEquals(List.of("P-INJ"), auth.patterns());
            Assertions.assertEquals("fail", items.get(1).workerClass());
            Assertions.assertEquals("custom/api.md", items.get(1).outputPath());

            DeclaredScope scope = selector.declaredScope();
            Assertions.assertTrue(scope.units().get(0).externallyReachable());
            Assertions.assertFalse(scope.units().get(1).externallyReachable());
            Assertions.assertTrue(scope.patterns().get(0).highRisk());
            Assertions.assertEquals(List.of("C-1", "C-2"), scope.checklist());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void duplicateIdsAndMissingFilesAreRejected() throws Exception {
        Path root = Files.createTempDirectory("auditforge-test-plan-invalid-");
        try {
            Path plan = root.resolve("plan.json");
            Files.writeString(plan, "{\"items\": [{\"id\": \"a\"}, {\"id\": \"a\"}]}", StandardCharsets.UTF_8);
            PlanFileSelector selector = PlanFileSelector.load(plan);
            Assertions.assertTrue(selector.declaredScope().isEmpty());
            Assertions.assertThrows(IllegalArgumentException.class, () -> selector.selectWorkItems(Phase.SCAN, null));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> PlanFileSelector.load(root.resolve("missing.json")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
