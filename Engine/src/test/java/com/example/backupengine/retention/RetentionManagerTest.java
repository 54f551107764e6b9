package com.example.backupengine.retention;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupengine.retention.Retention.BackupArtifact;
import com.example.backupengine.retention.Retention.DriveRetentionTarget;
import com.example.backupengine.retention.Retention.LocalRetentionTarget;
import com.example.backupengine.retention.Retention.PruneResult;
import com.example.backupengine.retention.Retention.RetentionManager;
import com.example.backupengine.retention.Retention.RetentionTarget;
import com.example.backupengine.storage.Storage.LocalFileSystem;
import com.example.backupengine.testing.InMemoryRemoteStorage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RetentionManagerTest {

    private final RetentionManager manager = new RetentionManager();

    private static List<String> names(List<BackupArtifact> artifacts) {
        return artifacts.stream().map(BackupArtifact::name).collect(Collectors.toList());
    }

    @Test
    void keepsNewestAndIgnoresForeignFiles() throws Exception {
        InMemoryRemoteStorage remote = new InMemoryRemoteStorage();
        remote.addFile("saves", "a", "talevox-backup-2024-01-01-100000.zip", Instant.parse("2024-01-01T10:00:00Z"));
        remote.addFile("saves", "b", "talevox-backup-2024-01-02-100000.zip", Instant.parse("2024-01-02T10:00:00Z"));
        remote.addFile("saves", "c", "talevox-backup-2024-01-03-100000.zip", Instant.parse("2024-01-03T10:00:00Z"));
        remote.addFile("saves", "p", "talevox-latest-backup.json", Instant.parse("2024-01-01T00:00:00Z"));
        remote.addFile("saves", "x", "notes.zip", Instant.parse("2023-01-01T00:00:00Z"));

        PruneResult result = manager.prune(new DriveRetentionTarget(remote, "saves"), 2);

        assertEquals(List.of("talevox-backup-2024-01-03-100000.zip", "talevox-backup-2024-01-02-100000.zip"),
                names(result.kept()));
        assertEquals(List.of("talevox-backup-2024-01-01-100000.zip"), names(result.deleted()));
        assertFalse(remote.exists("a"));
        assertTrue(remote.exists("p"));
        assertTrue(remote.exists("x"));
    }

    @Test
    void keepCountBelowOneStillKeepsNewest() throws Exception {
        InMemoryRemoteStorage remote = new InMemoryRemoteStorage();
        remote.addFile("saves", "a", "talevox-backup-2024-01-01-100000.zip", Instant.parse("2024-01-01T10:00:00Z"));
        remote.addFile("saves", "b", "talevox-backup-2024-01-02-100000.zip", Instant.parse("2024-01-02T10:00:00Z"));

        PruneResult result = manager.prune(new DriveRetentionTarget(remote, "saves"), 0);

        assertEquals(List.of("talevox-backup-2024-01-02-100000.zip"), names(result.kept()));
        assertEquals(1, result.deleted().size());
    }

    @Test
    void tiesOnModifiedTimeBreakByName() throws Exception {
        Instant same = Instant.parse("2024-01-01T10:00:00Z");
        InMemoryRemoteStorage remote = new InMemoryRemoteStorage();
        remote.addFile("saves", "a", "talevox-backup-2024-01-01-100000.zip", same);
        remote.addFile("saves", "b", "talevox-backup-2024-01-01-110000.zip", same);

        PruneResult result = manager.prune(new DriveRetentionTarget(remote, "saves"), 1);

        assertEquals(List.of("talevox-backup-2024-01-01-110000.zip"), names(result.kept()));
    }

    @Test
    void individualDeleteFailureIsReportedNotThrown() throws Exception {
        InMemoryRemoteStorage remote = new InMemoryRemoteStorage();
        remote.addFile("saves", "a", "talevox-backup-2024-01-01-100000.zip", Instant.parse("2024-01-01T10:00:00Z"));
        remote.addFile("saves", "b", "talevox-backup-2024-01-02-100000.zip", Instant.parse("2024-01-02T10:00:00Z"));
        remote.addFile("saves", "c", "talevox-backup-2024-01-03-100000.zip", Instant.parse("2024-01-03T10:00:00Z"));
        remote.failDeleteOf("a");

        PruneResult result = manager.prune(new DriveRetentionTarget(remote, "saves"), 1);

        assertEquals(List.of("talevox-backup-2024-01-02-100000.zip"), names(result.deleted()));
        assertEquals(List.of("talevox-backup-2024-01-01-100000.zip"), names(result.failed()));
        assertTrue(remote.exists("a"));
    }

    @Test
    void listingFailurePropagates() {
        RetentionTarget broken = new RetentionTarget() {
            @Override public String name() { return "broken"; }
            @Override public List<BackupArtifact> listArtifacts() throws IOException { throw new IOException("offline"); }
            @Override public void delete(BackupArtifact artifact) {}
        };

        assertThrows(IOException.class, () -> manager.prune(broken, 3));
    }

    @Test
    void localTargetPrunesByFileTime(@TempDir Path dir) throws Exception {
        LocalFileSystem fs = new LocalFileSystem(dir);
        Path backups = Files.createDirectories(dir.resolve(Retention.LOCAL_BACKUP_DIR));
        Path old = Files.write(backups.resolve("talevox-backup-2024-01-01-100000.zip"), new byte[] {1});
        Path recent = Files.write(backups.resolve("talevox-backup-2024-02-01-100000.zip"), new byte[] {2});
        Files.setLastModifiedTime(old, FileTime.from(Instant.parse("2024-01-01T10:00:00Z")));
        Files.setLastModifiedTime(recent, FileTime.from(Instant.parse("2024-02-01T10:00:00Z")));

        PruneResult result = manager.prune(new LocalRetentionTarget(fs), 1);

        assertEquals(1, result.deleted().size());
        assertFalse(Files.exists(old));
        assertTrue(Files.exists(recent));
    }

    @Test
    void missingLocalDirectoryIsEmpty(@TempDir Path dir) throws Exception {
        PruneResult result = manager.prune(new LocalRetentionTarget(new LocalFileSystem(dir)), 3);

        assertTrue(result.kept().isEmpty());
        assertTrue(result.deleted().isEmpty());
    }
}
