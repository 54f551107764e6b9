package com.example.backupengine.restore;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupengine.archive.Archive;
import com.example.backupengine.archive.Archive.ArchiveMeta;
import com.example.backupengine.archive.Archive.BackupOptions;
import com.example.backupengine.archive.Archive.Platform;
import com.example.backupengine.archive.ArchiveFormatException;
import com.example.backupengine.archive.ArchiveWriter;
import com.example.backupengine.db.Database.JsonDocumentStore;
import com.example.backupengine.library.Library.Attachment;
import com.example.backupengine.library.Library.BackupContext;
import com.example.backupengine.library.Library.Book;
import com.example.backupengine.library.Library.Chapter;
import com.example.backupengine.library.Library.FullSnapshot;
import com.example.backupengine.library.Snapshots.DefaultSnapshotBuilder;
import com.example.backupengine.packager.PackagerModule.ArchivePackager;
import com.example.backupengine.packager.PackagerModule.PackagedArchive;
import com.example.backupengine.prefs.Preferences.InMemoryPreferenceStore;
import com.example.backupengine.prefs.Preferences.PreferenceKeys;
import com.example.backupengine.restore.Restore.RestoreOrchestrator;
import com.example.backupengine.restore.Restore.RestoreResult;
import com.example.backupengine.restore.Restore.RestoreState;
import com.example.backupengine.storage.Storage.LocalFileSystem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RestoreOrchestratorTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = Archive.newMapper();
    private LocalFileSystem targetFs;
    private JsonDocumentStore targetDb;
    private InMemoryPreferenceStore targetPrefs;

    @BeforeEach
    void setUp() throws Exception {
        targetFs = new LocalFileSystem(tmp.resolve("target"));
        targetDb = new JsonDocumentStore(mapper);
        targetPrefs = new InMemoryPreferenceStore();
    }

    private RestoreOrchestrator.Builder orchestrator() {
        return RestoreOrchestrator.builder()
                .platform(Platform.ANDROID)
                .library(targetDb)
                .storageDriver(targetDb)
                .nativeExport(targetDb)
                .preferences(targetPrefs)
                .fileSystem(targetFs)
                .mapper(mapper);
    }

    private static FullSnapshot snapshot() {
        FullSnapshot s = new FullSnapshot();
        s.books.add(new Book("b1", "Livro"));
        s.chapters.add(new Chapter("c1", "b1", 1, "Um"));
        s.chapters.add(new Chapter("c2", "b1", 2, "Dois"));
        s.preferences.put("talevox_ui_mode", "night");
        return s;
    }

    private JsonNode meta(int schemaVersion, BackupOptions options) {
        return new ArchiveMeta(schemaVersion, "2.1.0", 1_700_000_000_000L, Platform.ANDROID, "Full backup",
                List.of(), options).toJson(mapper);
    }

    /** ZIP com as entradas dadas; valores byte[] vão crus, os demais como JSON. */
    private Path archive(Map<String, Object> entries) throws IOException {
        Path zip = Files.createTempFile(tmp, "backup-", ".zip");
        try (ArchiveWriter writer = new ArchiveWriter(zip, mapper)) {
            for (Map.Entry<String, Object> e : entries.entrySet()) {
                if (e.getValue() instanceof byte[]) {
                    writer.putBytes(e.getKey(), (byte[]) e.getValue());
                } else {
                    writer.putJson(e.getKey(), e.getValue());
                }
            }
        }
        return zip;
    }

    private Map<String, Object> minimal() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(Archive.META_ENTRY, meta(Archive.CURRENT_SCHEMA_VERSION, BackupOptions.defaults()));
        entries.put(Archive.SNAPSHOT_ENTRY, snapshot());
        return entries;
    }

    @Test
    void roundTripRestoresDatabasePreferencesAndFiles() throws Exception {
        LocalFileSystem sourceFs = new LocalFileSystem(tmp.resolve("source"));
        Path text = sourceFs.base().resolve("talevox/chapter_text/b1/001.txt");
        Files.createDirectories(text.getParent());
        Files.writeString(text, "Era uma vez");
        JsonDocumentStore sourceDb = new JsonDocumentStore(mapper);
        Book book = new Book("b1", "Livro");
        Chapter chapter = new Chapter("c1", "b1", 1, "Um");
        sourceDb.upsertBook(book);
        sourceDb.bulkUpsertChapters("b1", List.of(chapter));
        InMemoryPreferenceStore sourcePrefs = new InMemoryPreferenceStore(Map.of(
                "talevox_ui_mode", "night",
                "talevox_drive_token_v2", "secret"));
        PackagedArchive packed = ArchivePackager.builder()
                .appVersion("2.1.0")
                .snapshotBuilder(new DefaultSnapshotBuilder("2.1.0"))
                .preferences(sourcePrefs)
                .storageDriver(sourceDb)
                .nativeExport(sourceDb)
                .fileSystem(sourceFs)
                .mapper(mapper)
                .build()
                .pack(BackupOptions.defaults(),
                        BackupContext.builder().books(List.of(book)).chapters(List.of(chapter)).build(),
                        tmp.resolve("out"));

        RestoreOrchestrator restorer = orchestrator().build();
        RestoreResult result = restorer.restore(packed.path());

        assertFalse(result.usedSnapshotFallback());
        assertEquals(RestoreState.DONE, restorer.state());
        assertEquals("Livro", targetDb.listBooks().get(0).title);
        assertEquals(1, targetDb.listChapters("b1").size());
        assertEquals("night", targetPrefs.get("talevox_ui_mode").orElse(null));
        assertTrue(targetPrefs.get("talevox_drive_token_v2").isEmpty());
        assertEquals(1, result.filesRestored());
        assertEquals("Era uma vez", Files.readString(targetFs.base().resolve("talevox/chapter_text/b1/001.txt")));
        JsonNode persisted = mapper.readTree(targetPrefs.get(PreferenceKeys.RESTORE_WARNINGS).get());
        assertTrue(persisted.get("warnings").isArray());
        assertTrue(persisted.has("restoredAt"));
    }

    @Test
    void missingMetaFailsWithoutTouchingState() throws Exception {
        Map<String, Object> entries = minimal();
        entries.remove(Archive.META_ENTRY);
        RestoreOrchestrator restorer = orchestrator().build();

        ArchiveFormatException e = assertThrows(ArchiveFormatException.class,
                () -> restorer.restore(archive(entries)));

        assertEquals("Invalid backup ZIP: missing meta.json", e.getMessage());
        assertEquals(RestoreState.FAILED, restorer.state());
        assertTrue(targetDb.listBooks().isEmpty());
        assertTrue(targetPrefs.keys().isEmpty());
    }

    @Test
    void nonNumericSchemaVersionIsInvalidMetadata() throws Exception {
        Map<String, Object> entries = minimal();
        entries.put(Archive.META_ENTRY, mapper.createObjectNode().put("backupSchemaVersion", "one"));

        ArchiveFormatException e = assertThrows(ArchiveFormatException.class,
                () -> orchestrator().build().restore(archive(entries)));
        assertEquals("Invalid backup metadata.", e.getMessage());
    }

    @Test
    void missingSnapshotFails() throws Exception {
        Map<String, Object> entries = minimal();
        entries.remove(Archive.SNAPSHOT_ENTRY);

        ArchiveFormatException e = assertThrows(ArchiveFormatException.class,
                () -> orchestrator().build().restore(archive(entries)));
        assertEquals("Invalid backup ZIP: missing state/fullSnapshot.json", e.getMessage());
    }

    @Test
    void newerSchemaIsRejectedBeforeAnyWrite() throws Exception {
        Map<String, Object> entries = minimal();
        entries.put(Archive.META_ENTRY, meta(Archive.CURRENT_SCHEMA_VERSION + 1, BackupOptions.defaults()));
        entries.put(Archive.PREFS_ENTRY, Map.of("talevox_ui_mode", "day"));

        assertThrows(UnsupportedSchemaException.class, () -> orchestrator().build().restore(archive(entries)));
        assertTrue(targetDb.listBooks().isEmpty());
        assertTrue(targetPrefs.keys().isEmpty());
    }

    @Test
    void sentinelExportReplaysSnapshot() throws Exception {
        Map<String, Object> entries = minimal();
        entries.put(Archive.SQLITE_ENTRY, mapper.createObjectNode().put("mode", "web-fallback"));

        RestoreResult result = orchestrator().build().restore(archive(entries));

        assertTrue(result.usedSnapshotFallback());
        assertEquals(1, result.booksRestored());
        assertEquals(2, result.chaptersRestored());
        assertEquals(2, targetDb.listChapters("b1").size());
    }

    @Test
    void snapshotReplayKeepsAttachmentsWithoutBookAndReportsOrphanChapters() throws Exception {
        FullSnapshot snapshot = snapshot();
        snapshot.attachments.add(new Attachment("a1", "b1", "capa.jpg"));
        snapshot.attachments.add(new Attachment("a2", "ghost", "notas.pdf"));
        snapshot.chapters.add(new Chapter("c9", "ghost", 1, "Perdido"));
        Map<String, Object> entries = minimal();
        entries.put(Archive.SNAPSHOT_ENTRY, snapshot);
        entries.put(Archive.SQLITE_ENTRY, mapper.createObjectNode().put("mode", "unavailable"));

        RestoreResult result = orchestrator().build().restore(archive(entries));

        assertTrue(result.usedSnapshotFallback());
        assertEquals(List.of("a1", "a2"),
                targetDb.listAttachments().stream().map(a -> a.id).sorted().collect(Collectors.toList()));
        assertEquals(2, result.chaptersRestored());
        assertTrue(targetDb.listChapters("ghost").isEmpty());
        assertTrue(result.warnings().contains("snapshot-orphan-chapters:ghost:1"), result.warnings().toString());
    }

    @Test
    void invalidExportFallsBackWithWarning() throws Exception {
        Map<String, Object> entries = minimal();
        entries.put(Archive.SQLITE_ENTRY, mapper.createObjectNode().put("format", "something-else"));

        RestoreResult result = orchestrator().build().restore(archive(entries));

        assertTrue(result.usedSnapshotFallback());
        assertTrue(result.warnings().contains("sqlite-json-invalid-falling-back-to-snapshot"));
        assertEquals(1, targetDb.listBooks().size());
    }

    @Test
    void emptyPrefsFallBackToSnapshotPreferences() throws Exception {
        orchestrator().build().restore(archive(minimal()));

        assertEquals("night", targetPrefs.get("talevox_ui_mode").orElse(null));
    }

    @Test
    void oauthKeysRestoredOnlyWhenBackupIncludedThem() throws Exception {
        Map<String, Object> entries = minimal();
        entries.put(Archive.PREFS_ENTRY, Map.of("talevox_drive_token_v2", "secret", "talevox_ui_mode", "day"));
        orchestrator().build().restore(archive(entries));
        assertTrue(targetPrefs.get("talevox_drive_token_v2").isEmpty());
        assertEquals("day", targetPrefs.get("talevox_ui_mode").orElse(null));

        entries.put(Archive.META_ENTRY, meta(Archive.CURRENT_SCHEMA_VERSION, BackupOptions.defaults().withOAuthTokens(true)));
        orchestrator().build().restore(archive(entries));
        assertEquals("secret", targetPrefs.get("talevox_drive_token_v2").orElse(null));
    }

    @Test
    void traversalEntriesAreRejected() throws Exception {
        Map<String, Object> entries = minimal();
        entries.put("files/../evil.txt", new byte[] {6, 6, 6});
        entries.put("files/audio/b1/001.mp3", new byte[] {1, 2});

        RestoreResult result = orchestrator().build().restore(archive(entries));

        assertEquals(1, result.filesRestored());
        assertTrue(result.warnings().contains("file-restore-rejected:files/../evil.txt"));
        assertArrayEquals(new byte[] {1, 2}, Files.readAllBytes(targetFs.base().resolve("talevox/audio/b1/001.mp3")));
        assertFalse(Files.exists(targetFs.base().resolve("evil.txt")));
    }

    @Test
    void safeRelativeCheck() {
        assertTrue(RestoreOrchestrator.isSafeRelative("audio/b1/001.mp3"));
        assertFalse(RestoreOrchestrator.isSafeRelative("/etc/passwd"));
        assertFalse(RestoreOrchestrator.isSafeRelative("audio/../../x"));
        assertFalse(RestoreOrchestrator.isSafeRelative("audio\\x"));
        assertFalse(RestoreOrchestrator.isSafeRelative(""));
    }

    @Test
    void webPlatformSkipsFilesWithWarning() throws Exception {
        Map<String, Object> entries = minimal();
        entries.put("files/audio/b1/001.mp3", new byte[] {1});

        RestoreResult result = orchestrator().platform(Platform.WEB).build().restore(archive(entries));

        assertEquals(0, result.filesRestored());
        assertTrue(result.warnings().contains("native-files-restore-skipped-on-web"));
        assertTrue(result.usedSnapshotFallback());
    }

    @Test
    void listenerSeesResultBeforeDone() throws Exception {
        RestoreResult[] seen = new RestoreResult[1];
        RestoreOrchestrator restorer = orchestrator().listener(r -> seen[0] = r).build();

        RestoreResult result = restorer.restore(archive(minimal()));

        assertSame(result, seen[0]);
    }

    @Test
    void listenerFailureFailsRestore() throws Exception {
        RestoreOrchestrator restorer = orchestrator()
                .listener(r -> { throw new IOException("reload failed"); })
                .build();

        assertThrows(IOException.class, () -> restorer.restore(archive(minimal())));
        assertEquals(RestoreState.FAILED, restorer.state());
    }

    @Test
    void olderSchemaIsMigratedWithWarning() throws Exception {
        Map<String, Object> entries = minimal();
        entries.put(Archive.META_ENTRY, meta(0, BackupOptions.defaults()));

        RestoreResult result = orchestrator().build().restore(archive(entries));

        assertEquals(Archive.CURRENT_SCHEMA_VERSION, result.meta().schemaVersion());
        assertTrue(result.warnings().contains("Backup migrated from schema 0 to 1"));
    }
}
