package com.example.backupengine.backup;

import com.example.backupengine.archive.Archive;
import com.example.backupengine.archive.Archive.BackupFileNames;
import com.example.backupengine.archive.Archive.BackupOptions;
import com.example.backupengine.archive.Archive.ArchiveMeta;
import com.example.backupengine.config.AppConfig;
import com.example.backupengine.db.Database.LibraryStore;
import com.example.backupengine.db.Database.StorageDriver;
import com.example.backupengine.drive.DriveFolderAdapter;
import com.example.backupengine.folders.FolderManifests;
import com.example.backupengine.folders.FolderManifests.FileRef;
import com.example.backupengine.folders.FolderManifests.FolderRef;
import com.example.backupengine.library.Library.Attachment;
import com.example.backupengine.library.Library.BackupContext;
import com.example.backupengine.library.Library.Book;
import com.example.backupengine.library.Library.Chapter;
import com.example.backupengine.packager.PackagerModule;
import com.example.backupengine.packager.PackagerModule.ArchivePackager;
import com.example.backupengine.packager.PackagerModule.PackagedArchive;
import com.example.backupengine.prefs.Preferences.PreferenceKeys;
import com.example.backupengine.prefs.Preferences.PreferenceStore;
import com.example.backupengine.progress.Progress.ProgressEvent;
import com.example.backupengine.progress.Progress.ProgressListener;
import com.example.backupengine.progress.Progress.Step;
import com.example.backupengine.restore.Restore.RestoreOrchestrator;
import com.example.backupengine.restore.Restore.RestoreResult;
import com.example.backupengine.retention.Retention;
import com.example.backupengine.retention.Retention.DriveRetentionTarget;
import com.example.backupengine.retention.Retention.LocalRetentionTarget;
import com.example.backupengine.retention.Retention.PruneResult;
import com.example.backupengine.retention.Retention.RetentionManager;
import com.example.backupengine.retention.Retention.RetentionTarget;
import com.example.backupengine.storage.Storage;
import com.example.backupengine.storage.Storage.BackupTarget;
import com.example.backupengine.storage.Storage.NativeFileSystem;
import com.example.backupengine.storage.Storage.RemoteFile;
import com.example.backupengine.storage.Storage.RemoteStorage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordenação de backup e restauração: trava de execução única, destinos local e remoto,
 * ponteiro do último backup e retenção após cada save.
 */
public final class Backup {

    private Backup() {}

    // ---- Trava -----------------------------------------------------------

    /**
     * No máximo uma operação de backup/restauração por vez. Quem chega com a trava ocupada
     * não espera: recebe vazio.
     */
    public static final class BusyGuard {
        private final Semaphore permits = new Semaphore(1);

        public Optional<Permit> tryAcquire() {
            return permits.tryAcquire() ? Optional.of(new Permit(permits)) : Optional.empty();
        }

        public boolean isBusy() {
            return permits.availablePermits() == 0;
        }

        public static final class Permit implements AutoCloseable {
            private final Semaphore permits;
            private boolean released;

            private Permit(Semaphore permits) {
                this.permits = permits;
            }

            @Override
            public synchronized void close() {
                if (!released) {
                    released = true;
                    permits.release();
                }
            }
        }
    }

    // ---- Configurações ---------------------------------------------------

    /** Preferência talevox_backup_settings_v1. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BackupSettings {
        private static final Logger log = LoggerFactory.getLogger(BackupSettings.class);

        public int keepDriveBackups = 10;
        public int keepLocalBackups = 10;
        public int backupIntervalMin = 30;

        public BackupSettings() {
            // Jackson
        }

        public static BackupSettings defaults(AppConfig config) {
            BackupSettings s = new BackupSettings();
            if (config != null) {
                s.keepDriveBackups = config.keepDriveBackups();
                s.keepLocalBackups = config.keepLocalBackups();
            }
            return s;
        }

        /** Lê a preferência; ausente ou ilegível devolve {@code fallback}. */
        public static BackupSettings load(PreferenceStore prefs, ObjectMapper mapper, BackupSettings fallback)
                throws IOException {
            Optional<String> raw = prefs.get(PreferenceKeys.BACKUP_SETTINGS);
            if (raw.isEmpty()) return fallback;
            try {
                return mapper.readValue(raw.get(), BackupSettings.class);
            } catch (IOException e) {
                log.warn("Configurações de backup ilegíveis, usando padrão: {}", e.getMessage());
                return fallback;
            }
        }

        public void save(PreferenceStore prefs, ObjectMapper mapper) throws IOException {
            prefs.set(PreferenceKeys.BACKUP_SETTINGS, mapper.writeValueAsString(this));
        }
    }

    // ---- Ponteiro remoto -------------------------------------------------

    /** Índice de conveniência do último backup remoto; sobrescrito a cada envio. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LatestBackupPointer {
        public int schemaVersion = 1;
        public String latestFileName;
        public long latestCreatedAt;
        public String latestFileId;
        public int backupSchemaVersion;

        public LatestBackupPointer() {
            // Jackson
        }

        public LatestBackupPointer(String latestFileName, long latestCreatedAt, String latestFileId, int backupSchemaVersion) {
            this.latestFileName = latestFileName;
            this.latestCreatedAt = latestCreatedAt;
            this.latestFileId = latestFileId;
            this.backupSchemaVersion = backupSchemaVersion;
        }
    }

    public static final class SaveResult {
        private final BackupTarget target;
        private final String fileName;
        private final String location;
        private final ArchiveMeta meta;
        private final long sizeBytes;
        private final PruneResult retention;

        public SaveResult(BackupTarget target, String fileName, String location, ArchiveMeta meta,
                          long sizeBytes, PruneResult retention) {
            this.target = Objects.requireNonNull(target, "target");
            this.fileName = Objects.requireNonNull(fileName, "fileName");
            this.location = Objects.requireNonNull(location, "location");
            this.meta = Objects.requireNonNull(meta, "meta");
            this.sizeBytes = sizeBytes;
            this.retention = retention;
        }

        public BackupTarget target() { return target; }
        public String fileName() { return fileName; }
        /** Caminho no filesystem nativo (local) ou id do arquivo (drive). */
        public String location() { return location; }
        public ArchiveMeta meta() { return meta; }
        public long sizeBytes() { return sizeBytes; }
        /** Vazio quando a retenção não rodou ou falhou. */
        public Optional<PruneResult> retention() { return Optional.ofNullable(retention); }
    }

    // ---- Contexto --------------------------------------------------------

    /** Fonte do contexto de backup (estado vivo do app). */
    @FunctionalInterface
    public interface ContextProvider {
        BackupContext collect() throws IOException;
    }

    /** Monta o contexto a partir dos stores do app. */
    public static final class StoreContextProvider implements ContextProvider {
        private static final Logger log = LoggerFactory.getLogger(StoreContextProvider.class);

        private final LibraryStore library;
        private final StorageDriver storageDriver;
        private final PreferenceStore preferences;
        private final ObjectMapper mapper;

        public StoreContextProvider(LibraryStore library, StorageDriver storageDriver,
                                    PreferenceStore preferences, ObjectMapper mapper) {
            this.library = Objects.requireNonNull(library, "library");
            this.storageDriver = storageDriver;
            this.preferences = Objects.requireNonNull(preferences, "preferences");
            this.mapper = Objects.requireNonNull(mapper, "mapper");
        }

        @Override
        public BackupContext collect() throws IOException {
            List<Book> books = library.listBooks();
            List<Chapter> chapters = new ArrayList<>();
            for (Book b : books) {
                chapters.addAll(library.listChapters(b.id));
            }
            List<Attachment> attachments = library.listAttachments();

            Map<String, String> prefs = new LinkedHashMap<>();
            for (String key : PreferenceKeys.SAFE_KEYS) {
                preferences.get(key).ifPresent(v -> prefs.put(key, v));
            }
            return BackupContext.builder()
                    .books(books)
                    .chapters(chapters)
                    .attachments(attachments)
                    .jobs(storageDriver == null ? List.of() : storageDriver.listJobs())
                    .preferences(prefs)
                    .readerProgress(jsonPref(Archive.PRODUCT + "_reader_progress"))
                    .legacyProgressStore(jsonPref(Archive.PRODUCT + "_progress_store"))
                    .build();
        }

        private JsonNode jsonPref(String key) throws IOException {
            Optional<String> raw = preferences.get(key);
            if (raw.isEmpty()) return null;
            try {
                return mapper.readTree(raw.get());
            } catch (IOException e) {
                log.debug("Preferência {} não é JSON; fica fora do snapshot: {}", key, e.getMessage());
                return null;
            }
        }
    }

    // ===== COORDENADOR =====

    public static final class BackupCoordinator implements Closeable {
        private static final Logger log = LoggerFactory.getLogger(BackupCoordinator.class);

        private static final String ZIP_MIME = "application/zip";
        private static final String JSON_MIME = "application/json";

        private final ArchivePackager packager;
        private final RestoreOrchestrator restorer;
        private final ContextProvider contextProvider;
        private final PreferenceStore preferences;
        private final NativeFileSystem fileSystem;
        private final RemoteStorage remote;
        private final String driveRootFolderId;
        private final BackupSettings defaultSettings;
        private final Path workDir;
        private final ObjectMapper mapper;
        private final RetentionManager retention = new RetentionManager();
        private final BusyGuard busy = new BusyGuard();
        private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "backup-coordinator");
            t.setDaemon(true);
            return t;
        });

        private BackupCoordinator(Builder b) {
            this.packager = Objects.requireNonNull(b.packager, "packager");
            this.restorer = Objects.requireNonNull(b.restorer, "restorer");
            this.contextProvider = Objects.requireNonNull(b.contextProvider, "contextProvider");
            this.preferences = Objects.requireNonNull(b.preferences, "preferences");
            this.workDir = Objects.requireNonNull(b.workDir, "workDir");
            this.fileSystem = b.fileSystem;
            this.remote = b.remote;
            this.driveRootFolderId = b.driveRootFolderId;
            this.defaultSettings = b.defaultSettings == null ? new BackupSettings() : b.defaultSettings;
            this.mapper = b.mapper == null ? Archive.newMapper() : b.mapper;
        }

        public static Builder builder() { return new Builder(); }

        public static final class Builder {
            private ArchivePackager packager;
            private RestoreOrchestrator restorer;
            private ContextProvider contextProvider;
            private PreferenceStore preferences;
            private NativeFileSystem fileSystem;
            private RemoteStorage remote;
            private String driveRootFolderId;
            private BackupSettings defaultSettings;
            private Path workDir;
            private ObjectMapper mapper;

            private Builder() {}

            public Builder packager(ArchivePackager v) { packager = v; return this; }
            public Builder restorer(RestoreOrchestrator v) { restorer = v; return this; }
            public Builder contextProvider(ContextProvider v) { contextProvider = v; return this; }
            public Builder preferences(PreferenceStore v) { preferences = v; return this; }
            public Builder fileSystem(NativeFileSystem v) { fileSystem = v; return this; }
            /** Remoto e pasta raiz são opcionais; sem eles o destino drive fica indisponível. */
            public Builder remote(RemoteStorage v, String rootFolderId) { remote = v; driveRootFolderId = rootFolderId; return this; }
            public Builder defaultSettings(BackupSettings v) { defaultSettings = v; return this; }
            public Builder workDir(Path v) { workDir = v; return this; }
            public Builder mapper(ObjectMapper v) { mapper = v; return this; }
            public BackupCoordinator build() { return new BackupCoordinator(this); }
        }

        public boolean isBusy() {
            return busy.isBusy();
        }

        public BackupSettings settings() throws IOException {
            return BackupSettings.load(preferences, mapper, defaultSettings);
        }

        // ---- Backup ----

        public Optional<SaveResult> backupNow(BackupTarget target, BackupOptions options) throws IOException {
            return backupNow(target, options, ProgressListener.NONE);
        }

        /**
         * Gera e salva um backup. Vazio se outra operação já estiver em andamento.
         */
        public Optional<SaveResult> backupNow(BackupTarget target, BackupOptions options, ProgressListener listener)
                throws IOException {
            Objects.requireNonNull(target, "target");
            Optional<BusyGuard.Permit> permit = busy.tryAcquire();
            if (permit.isEmpty()) {
                log.debug("Backup ignorado: outra operação em andamento");
                return Optional.empty();
            }
            return Optional.of(runBackup(permit.get(), target, options, listener));
        }

        /** Executa o backup com a permissão já obtida; a permissão é liberada ao final. */
        private SaveResult runBackup(BusyGuard.Permit permit, BackupTarget target, BackupOptions options,
                                     ProgressListener listener) throws IOException {
            ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
            try (BusyGuard.Permit ignored = permit) {
                BackupContext context = contextProvider.collect();
                Files.createDirectories(workDir);
                PackagedArchive archive = packager.pack(options, context, workDir, progress);
                try {
                    SaveResult result = target == BackupTarget.DRIVE ? saveToDrive(archive) : saveToLocal(archive);
                    progress.onProgress(ProgressEvent.of(Step.DONE, result.fileName()));
                    return result;
                } finally {
                    deleteQuietly(archive.path());
                }
            } catch (IOException | RuntimeException e) {
                progress.onProgress(ProgressEvent.of(Step.FAILED, PackagerModule.message(e)));
                log.error("Falha no backup para {}: {}", target.wireName(), e.getMessage());
                throw e;
            }
        }

        private SaveResult saveToLocal(PackagedArchive archive) throws IOException {
            NativeFileSystem fs = requireFileSystem();
            fs.mkdirs(Retention.LOCAL_BACKUP_DIR);
            String path = Storage.join(Retention.LOCAL_BACKUP_DIR, archive.fileName());
            if (fs.stat(path).isPresent()) {
                throw new FileAlreadyExistsException(path, null, "backup com o mesmo nome já existe");
            }
            try (InputStream in = Files.newInputStream(archive.path())) {
                fs.write(path, in);
            }
            log.info("Backup salvo localmente em {} ({} bytes)", path, archive.sizeBytes());
            PruneResult pruned = pruneQuietly(new LocalRetentionTarget(fs), settings().keepLocalBackups);
            return new SaveResult(BackupTarget.LOCAL, archive.fileName(), path, archive.meta(), archive.sizeBytes(), pruned);
        }

        private SaveResult saveToDrive(PackagedArchive archive) throws IOException {
            FolderRef saves = savesFolder();
            RemoteFile uploaded = remote.uploadFile(saves.id(), archive.fileName(), ZIP_MIME, archive.path(), null);
            log.info("Backup enviado ao Drive: {} ({})", uploaded.name(), uploaded.id());
            writePointer(saves, new LatestBackupPointer(archive.fileName(), archive.meta().createdAt(),
                    uploaded.id(), archive.meta().schemaVersion()));
            PruneResult pruned = pruneQuietly(new DriveRetentionTarget(remote, saves.id()), settings().keepDriveBackups);
            return new SaveResult(BackupTarget.DRIVE, archive.fileName(), uploaded.id(), archive.meta(),
                    archive.sizeBytes(), pruned);
        }

        private void writePointer(FolderRef saves, LatestBackupPointer pointer) throws IOException {
            DriveFolderAdapter adapter = new DriveFolderAdapter(remote);
            Optional<FileRef> existing = adapter.findByName(saves, BackupFileNames.POINTER_FILE_NAME);
            remote.upload(saves.id(), BackupFileNames.POINTER_FILE_NAME, JSON_MIME,
                    mapper.writeValueAsBytes(pointer), existing.map(FileRef::id).orElse(null));
        }

        /** Retenção é otimização: falha na listagem não derruba o save. */
        private PruneResult pruneQuietly(RetentionTarget target, int keep) {
            try {
                return retention.prune(target, keep);
            } catch (IOException | RuntimeException e) {
                log.warn("Falha ao aplicar retenção em {}: {}", target.name(), e.getMessage());
                return null;
            }
        }

        public PruneResult prune(BackupTarget target, int keep) throws IOException {
            RetentionTarget t = target == BackupTarget.DRIVE
                    ? new DriveRetentionTarget(requireRemote(), savesFolder().id())
                    : new LocalRetentionTarget(requireFileSystem());
            return retention.prune(t, keep);
        }

        // ---- Listagem remota ----

        /** Backups no Drive, do mais recente para o mais antigo. */
        public List<RemoteFile> listDriveBackups() throws IOException {
            FolderRef saves = savesFolder();
            List<RemoteFile> out = new ArrayList<>();
            for (RemoteFile f : remote.listFiles(saves.id())) {
                if (!f.isFolder() && BackupFileNames.isBackupArtifact(f.name())) {
                    out.add(f);
                }
            }
            out.sort(Comparator.comparing((RemoteFile f) -> f.modifiedTime().orElse(Instant.EPOCH))
                    .thenComparing(RemoteFile::name)
                    .reversed());
            return out;
        }

        public Optional<LatestBackupPointer> readPointer() throws IOException {
            FolderRef saves = savesFolder();
            List<FileRef> files = new DriveFolderAdapter(remote).list(saves);
            Optional<FileRef> ref = FolderManifests.newestNamed(files, BackupFileNames.POINTER_FILE_NAME, false);
            if (ref.isEmpty()) return Optional.empty();
            String raw = new String(remote.fetch(ref.get().id()), StandardCharsets.UTF_8);
            return Optional.of(mapper.readValue(raw, LatestBackupPointer.class));
        }

        // ---- Restauração ----

        public Optional<RestoreResult> restoreFromFile(Path archive) throws IOException {
            return restoreFromFile(archive, ProgressListener.NONE);
        }

        public Optional<RestoreResult> restoreFromFile(Path archive, ProgressListener listener) throws IOException {
            Objects.requireNonNull(archive, "archive");
            Optional<BusyGuard.Permit> permit = busy.tryAcquire();
            if (permit.isEmpty()) {
                log.debug("Restauração ignorada: outra operação em andamento");
                return Optional.empty();
            }
            return Optional.of(runRestore(permit.get(), archive, listener));
        }

        private RestoreResult runRestore(BusyGuard.Permit permit, Path archive, ProgressListener listener)
                throws IOException {
            try (BusyGuard.Permit ignored = permit) {
                return restorer.restore(archive, listener);
            }
        }

        /** Baixa o backup do Drive para um temporário e restaura. */
        public Optional<RestoreResult> restoreFromDrive(String fileId, ProgressListener listener) throws IOException {
            Objects.requireNonNull(fileId, "fileId");
            RemoteStorage r = requireRemote();
            Optional<BusyGuard.Permit> permit = busy.tryAcquire();
            if (permit.isEmpty()) {
                log.debug("Restauração ignorada: outra operação em andamento");
                return Optional.empty();
            }
            try (BusyGuard.Permit ignored = permit.get()) {
                Files.createDirectories(workDir);
                Path tmp = Files.createTempFile(workDir, "restore-", ".zip");
                try {
                    r.download(fileId, tmp);
                    log.info("Backup {} baixado do Drive ({} bytes)", fileId, Files.size(tmp));
                    return Optional.of(restorer.restore(tmp, listener));
                } finally {
                    deleteQuietly(tmp);
                }
            }
        }

        // ---- Assíncrono ----

        // A permissão é tomada na thread chamadora: pedido feito durante outra operação não entra na fila.

        public CompletableFuture<Optional<SaveResult>> submitBackup(BackupTarget target, BackupOptions options,
                                                                    ProgressListener listener) {
            Objects.requireNonNull(target, "target");
            Optional<BusyGuard.Permit> permit = busy.tryAcquire();
            if (permit.isEmpty()) {
                log.debug("Backup ignorado: outra operação em andamento");
                return CompletableFuture.completedFuture(Optional.empty());
            }
            return submit(permit.get(), () -> runBackup(permit.get(), target, options, listener));
        }

        public CompletableFuture<Optional<RestoreResult>> submitRestore(Path archive, ProgressListener listener) {
            Objects.requireNonNull(archive, "archive");
            Optional<BusyGuard.Permit> permit = busy.tryAcquire();
            if (permit.isEmpty()) {
                log.debug("Restauração ignorada: outra operação em andamento");
                return CompletableFuture.completedFuture(Optional.empty());
            }
            return submit(permit.get(), () -> runRestore(permit.get(), archive, listener));
        }

        private <T> CompletableFuture<Optional<T>> submit(BusyGuard.Permit permit, IoTask<T> task) {
            try {
                return CompletableFuture.supplyAsync(() -> {
                    try {
                        return Optional.of(task.run());
                    } catch (IOException e) {
                        throw new CompletionException(e);
                    }
                }, executor);
            } catch (RejectedExecutionException e) {
                permit.close();
                throw e;
            }
        }

        @FunctionalInterface
        private interface IoTask<T> {
            T run() throws IOException;
        }

        // ---- Auxiliares ----

        private FolderRef savesFolder() throws IOException {
            RemoteStorage r = requireRemote();
            return new DriveFolderAdapter(r).ensureRootStructure(driveRootFolderId);
        }

        private RemoteStorage requireRemote() {
            if (remote == null || driveRootFolderId == null) {
                throw new IllegalStateException("Destino drive não configurado (DRIVE_ROOT_FOLDER_ID)");
            }
            return remote;
        }

        private NativeFileSystem requireFileSystem() {
            if (fileSystem == null) {
                throw new IllegalStateException("Filesystem nativo indisponível nesta plataforma");
            }
            return fileSystem;
        }

        private static void deleteQuietly(Path path) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Não foi possível remover temporário {}: {}", path, e.toString());
            }
        }

        @Override
        public void close() {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
