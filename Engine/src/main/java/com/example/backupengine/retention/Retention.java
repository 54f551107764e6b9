package com.example.backupengine.retention;

import com.example.backupengine.archive.Archive;
import com.example.backupengine.archive.Archive.BackupFileNames;
import com.example.backupengine.storage.Storage;
import com.example.backupengine.storage.Storage.DirEntry;
import com.example.backupengine.storage.Storage.NativeFileSystem;
import com.example.backupengine.storage.Storage.RemoteFile;
import com.example.backupengine.storage.Storage.RemoteStorage;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retenção de backups históricos nos dois destinos (filesystem nativo e pasta remota).
 */
public final class Retention {

    private Retention() {}

    /** Diretório dos backups locais no filesystem nativo. */
    public static final String LOCAL_BACKUP_DIR = Archive.PRODUCT + "/backups";

    public static final class BackupArtifact {
        private final String id;
        private final String name;
        private final Instant modifiedAt;
        private final long size;

        public BackupArtifact(String id, String name, Instant modifiedAt, long size) {
            this.id = Objects.requireNonNull(id, "id");
            this.name = Objects.requireNonNull(name, "name");
            this.modifiedAt = modifiedAt == null ? Instant.EPOCH : modifiedAt;
            this.size = size;
        }

        /** Identificador no destino: caminho relativo (local) ou id do arquivo (remoto). */
        public String id() { return id; }
        public String name() { return name; }
        public Instant modifiedAt() { return modifiedAt; }
        public long size() { return size; }

        @Override
        public String toString() {
            return name + "@" + modifiedAt;
        }
    }

    /** Destino onde backups são listados e apagados. */
    public interface RetentionTarget {
        String name();

        /** Apenas artefatos no padrão de nome de backup. */
        List<BackupArtifact> listArtifacts() throws IOException;

        void delete(BackupArtifact artifact) throws IOException;
    }

    public static final class PruneResult {
        private final List<BackupArtifact> kept;
        private final List<BackupArtifact> deleted;
        private final List<BackupArtifact> failed;

        public PruneResult(List<BackupArtifact> kept, List<BackupArtifact> deleted, List<BackupArtifact> failed) {
            this.kept = Collections.unmodifiableList(new ArrayList<>(kept));
            this.deleted = Collections.unmodifiableList(new ArrayList<>(deleted));
            this.failed = Collections.unmodifiableList(new ArrayList<>(failed));
        }

        public List<BackupArtifact> kept() { return kept; }
        public List<BackupArtifact> deleted() { return deleted; }
        public List<BackupArtifact> failed() { return failed; }
    }

    // ---- Destinos --------------------------------------------------------

    public static final class LocalRetentionTarget implements RetentionTarget {
        private final NativeFileSystem fileSystem;
        private final String directory;

        public LocalRetentionTarget(NativeFileSystem fileSystem) {
            this(fileSystem, LOCAL_BACKUP_DIR);
        }

        public LocalRetentionTarget(NativeFileSystem fileSystem, String directory) {
            this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
            this.directory = Objects.requireNonNull(directory, "directory");
        }

        @Override
        public String name() { return "local"; }

        @Override
        public List<BackupArtifact> listArtifacts() throws IOException {
            List<DirEntry> entries;
            try {
                entries = fileSystem.list(directory);
            } catch (NoSuchFileException e) {
                return List.of();
            }
            List<BackupArtifact> out = new ArrayList<>();
            for (DirEntry e : entries) {
                if (!e.directory() && BackupFileNames.isBackupArtifact(e.name())) {
                    out.add(new BackupArtifact(Storage.join(directory, e.name()), e.name(), e.modifiedAt(), e.size()));
                }
            }
            return out;
        }

        @Override
        public void delete(BackupArtifact artifact) throws IOException {
            fileSystem.delete(artifact.id());
        }
    }

    public static final class DriveRetentionTarget implements RetentionTarget {
        private final RemoteStorage remote;
        private final String folderId;

        public DriveRetentionTarget(RemoteStorage remote, String folderId) {
            this.remote = Objects.requireNonNull(remote, "remote");
            this.folderId = Objects.requireNonNull(folderId, "folderId");
        }

        @Override
        public String name() { return "drive"; }

        @Override
        public List<BackupArtifact> listArtifacts() throws IOException {
            List<BackupArtifact> out = new ArrayList<>();
            for (RemoteFile f : remote.listFiles(folderId)) {
                if (!f.isFolder() && BackupFileNames.isBackupArtifact(f.name())) {
                    out.add(new BackupArtifact(f.id(), f.name(), f.modifiedTime().orElse(null), f.size()));
                }
            }
            return out;
        }

        @Override
        public void delete(BackupArtifact artifact) throws IOException {
            remote.delete(artifact.id());
        }
    }

    // ---- Gerente ---------------------------------------------------------

    /**
     * Mantém os {@code max(1, keep)} artefatos mais recentes. Falhas de remoção individuais são
     * registradas e ignoradas; a listagem falhando é propagada.
     */
    public static final class RetentionManager {
        private static final Logger log = LoggerFactory.getLogger(RetentionManager.class);

        /** Mais recente primeiro; empate desfeito pelo nome (que carrega o timestamp). */
        static final Comparator<BackupArtifact> NEWEST_FIRST = Comparator
                .comparing(BackupArtifact::modifiedAt)
                .thenComparing(BackupArtifact::name)
                .reversed();

        public PruneResult prune(RetentionTarget target, int keepCount) throws IOException {
            Objects.requireNonNull(target, "target");
            int keep = Math.max(1, keepCount);
            List<BackupArtifact> artifacts = new ArrayList<>(target.listArtifacts());
            artifacts.sort(NEWEST_FIRST);

            List<BackupArtifact> kept = new ArrayList<>(artifacts.subList(0, Math.min(keep, artifacts.size())));
            List<BackupArtifact> deleted = new ArrayList<>();
            List<BackupArtifact> failed = new ArrayList<>();
            for (BackupArtifact artifact : artifacts.subList(kept.size(), artifacts.size())) {
                try {
                    target.delete(artifact);
                    deleted.add(artifact);
                } catch (IOException | RuntimeException e) {
                    log.warn("Falha ao remover backup antigo {} em {}: {}", artifact.name(), target.name(), e.getMessage());
                    failed.add(artifact);
                }
            }
            if (!deleted.isEmpty() || !failed.isEmpty()) {
                log.info("Retenção em {}: {} mantidos, {} removidos, {} falhas",
                        target.name(), kept.size(), deleted.size(), failed.size());
            }
            return new PruneResult(kept, deleted, failed);
        }
    }
}
