package io.taskmaster.identity;

import io.taskmaster.config.TaskMasterConfig;
import io.taskmaster.model.DuplicateRelationship;
import io.taskmaster.model.RelationType;
import io.taskmaster.parser.ParserRegistry;
import io.taskmaster.scan.DiscoveredPath;
import io.taskmaster.scan.DiscoveryStage;
import io.taskmaster.scan.DiscoveryWalk;
import io.taskmaster.scan.ScanBudget;
import io.taskmaster.scan.ScanFilters;
import io.taskmaster.storage.Database;
import io.taskmaster.storage.DuplicateStore;
import io.taskmaster.storage.FileIndexStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class DedupEngineTest {

    @Test
    void identicalActiveFilesGroupUnderTheLowestId() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-dedup-data-");
        Path docs = Files.createTempDirectory("taskmaster-test-dedup-docs-");
        try {
            write(docs.resolve("a.txt"), "same bytes");
            write(docs.resolve("b.txt"), "same bytes");
            write(docs.resolve("c.txt"), "different bytes");
            write(docs.resolve("d.pdf"), "same bytes");

            Database db = new Database(TaskMasterConfig.fromRoot(dataDir.toString()));
            db.init();
            FileIndexStore files = new FileIndexStore(db);
            DuplicateStore duplicates = new DuplicateStore(db);
            Map<String, Long> ids = index(new IdentityEngine(files, ParserRegistry.withDefaults(), () -> 1_000L), docs);
            DedupEngine dedup = new DedupEngine(duplicates, () -> 2_000L);

            DuplicateStore.RebuildResult result = dedup.rebuildDuplicateGroups();
            Assertions.assertEquals(new DuplicateStore.RebuildResult(1, 1), result);

            List<DuplicateRelationship> exact = duplicates.listRelationships(RelationType.EXACT);
            Assertions.assertEquals(1, exact.size());
            Assertions.assertEquals(ids.get("a.txt"), exact.get(0).canonicalFileId());
            Assertions.assertEquals(ids.get("b.txt"), exact.get(0).duplicateFileId());
            Assertions.assertEquals(1.0d, exact.get(0).confidence());
            Assertions.assertEquals("sha256", exact.get(0).matchBasis());

            DuplicateStore.DuplicateSummary ofB = duplicates.duplicatesOf(ids.get("b.txt")).orElseThrow();
            Assertions.assertEquals(ids.get("a.txt"), ofB.duplicateOf().canonicalFileId());
            Assertions.assertTrue(ofB.exactDuplicates().isEmpty());
            DuplicateStore.DuplicateSummary ofA = duplicates.duplicatesOf(ids.get("a.txt")).orElseThrow();
            Assertions.assertNull(ofA.duplicateOf());
            Assertions.assertEquals(1, ofA.exactDuplicates().size());
            DuplicateStore.DuplicateSummary ofC = duplicates.duplicatesOf(ids.get("c.txt")).orElseThrow();
            Assertions.assertNull(ofC.duplicateOf());
            Assertions.assertTrue(ofC.exactDuplicates().isEmpty());
            Assertions.assertTrue(duplicates.duplicatesOf(9_999L).isEmpty());

            Assertions.assertEquals(result, dedup.rebuildDuplicateGroups());
            Assertions.assertEquals(exact.size(), duplicates.listRelationships(RelationType.EXACT).size());
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void missingFilesLeaveTheirGroups() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-dedup-missing-data-");
        Path docs = Files.createTempDirectory("taskmaster-test-dedup-missing-docs-");
        try {
            write(docs.resolve("a.txt"), "twin");
            write(docs.resolve("b.txt"), "twin");

            Database db = new Database(TaskMasterConfig.fromRoot(dataDir.toString()));
            db.init();
            FileIndexStore files = new FileIndexStore(db);
            DuplicateStore duplicates = new DuplicateStore(db);
            Map<String, Long> ids = index(new IdentityEngine(files, ParserRegistry.withDefaults(), () -> 1_000L), docs);
            DedupEngine dedup = new DedupEngine(duplicates);
            Assertions.assertEquals(1, dedup.rebuildDuplicateGroups().relationships());

            files.markMissing(files.getFile(ids.get("a.txt")).orElseThrow(),
                    IdentityEngine.pathHash(new DiscoveredPath(
                            docs.resolve("a.txt"), docs, "a.txt", 0L, 0L, ".txt", "text/plain")),
                    "run_2", 3_000L);
            Assertions.assertEquals(new DuplicateStore.RebuildResult(0, 0), dedup.rebuildDuplicateGroups());
            Assertions.assertTrue(duplicates.listRelationships(RelationType.EXACT).isEmpty());
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    private static Map<String, Long> index(IdentityEngine identity, Path root) throws IOException {
        DiscoveryWalk walk = new DiscoveryStage().discover(root, ScanFilters.defaults(), ScanBudget.unbounded());
        Map<String, Long> ids = new LinkedHashMap<>();
        while (walk.hasNext()) {
            DiscoveredPath discovered = walk.next();
            ids.put(discovered.relativePath(), identity.observe(discovered, "run_1").fileId());
        }
        return ids;
    }

    private static Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content, StandardCharsets.UTF_8);
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
