package com.example.backupengine.packager;

import com.example.backupengine.archive.Archive;
import com.example.backupengine.archive.Archive.ArchiveMeta;
import com.example.backupengine.archive.Archive.BackupFileNames;
import com.example.backupengine.archive.Archive.BackupOptions;
import com.example.backupengine.archive.Archive.FileManifestEntry;
import com.example.backupengine.archive.Archive.Platform;
import com.example.backupengine.archive.Archive.StorageDriverState;
import com.example.backupengine.archive.ArchiveWriter;
import com.example.backupengine.db.Database.NativeExport;
import com.example.backupengine.db.Database.StorageDriver;
import com.example.backupengine.library.Library.BackupContext;
import com.example.backupengine.library.Library.FullSnapshot;
import com.example.backupengine.library.Snapshots.SnapshotBuilder;
import com.example.backupengine.prefs.Preferences.PreferenceKeys;
import com.example.backupengine.prefs.Preferences.PreferenceStore;
import com.example.backupengine.progress.Progress.ProgressEvent;
import com.example.backupengine.progress.Progress.ProgressListener;
import com.example.backupengine.progress.Progress.Step;
import com.example.backupengine.storage.Storage;
import com.example.backupengine.storage.Storage.DirEntry;
import com.example.backupengine.storage.Storage.NativeFileSystem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Empacotamento do estado durável do app num ZIP versionado e portátil.
 * <p>
 * Só a montagem do snapshot é fatal; falhas nas demais fontes viram avisos em meta.json.
 */
public final class PackagerModule {

    private PackagerModule() {}

    /** Diretório do app no filesystem nativo. */
    public static final String NATIVE_BASE = Archive.PRODUCT;

    public static final String NOTES = "Full backup";

    /** Raízes de conteúdo varridas, cada uma controlada por uma opção. */
    public enum ContentRoot {
        CHAPTER_TEXT("chapter_text"),
        AUDIO("audio"),
        ATTACHMENTS("attachments"),
        DIAGNOSTICS("diagnostics");

        private final String dirName;

        ContentRoot(String dirName) { this.dirName = dirName; }

        public String dirName() { return dirName; }

        public boolean enabled(BackupOptions options) {
            switch (this) {
                case CHAPTER_TEXT: return options.includeChapterText();
                case AUDIO: return options.includeAudio();
                case ATTACHMENTS: return options.includeAttachments();
                case DIAGNOSTICS: return options.includeDiagnostics();
                default: return false;
            }
        }
    }

    // ---- Sentinelas do export relacional ----------------------------------

    public static final String SENTINEL_MODE = "mode";

    /** Export ausente por qualquer motivo vira um objeto com "mode"; o restore nunca o importa. */
    public static boolean isSentinel(JsonNode export) {
        return export != null && export.isObject() && export.has(SENTINEL_MODE);
    }

    /**
     * Resultado do empacotamento.
     */
    public static final class PackagedArchive {
        private final Path path;
        private final ArchiveMeta meta;
        private final List<FileManifestEntry> fileManifest;
        private final int filesIncluded;
        private final long sizeBytes;

        public PackagedArchive(Path path, ArchiveMeta meta, List<FileManifestEntry> fileManifest,
                               int filesIncluded, long sizeBytes) {
            this.path = Objects.requireNonNull(path, "path");
            this.meta = Objects.requireNonNull(meta, "meta");
            this.fileManifest = Collections.unmodifiableList(new ArrayList<>(fileManifest));
            this.filesIncluded = filesIncluded;
            this.sizeBytes = sizeBytes;
        }

        public Path path() { return path; }
        public String fileName() { return path.getFileName().toString(); }
        public ArchiveMeta meta() { return meta; }
        public List<FileManifestEntry> fileManifest() { return fileManifest; }
        public int filesIncluded() { return filesIncluded; }
        public long sizeBytes() { return sizeBytes; }
    }

    /**
     * Empacotador. Colaboradores opcionais (driver, export, filesystem) podem ser nulos.
     */
    public static final class ArchivePackager {
        private static final Logger log = LoggerFactory.getLogger(ArchivePackager.class);

        private final Platform platform;
        private final String appVersion;
        private final SnapshotBuilder snapshotBuilder;
        private final PreferenceStore preferences;
        private final StorageDriver storageDriver;
        private final NativeExport nativeExport;
        private final NativeFileSystem fileSystem;
        private final ObjectMapper mapper;
        private final long largeFileThreshold;
        private final ZoneId zone;
        private final Clock clock;

        private ArchivePackager(Builder b) {
            this.platform = Objects.requireNonNull(b.platform, "platform");
            this.appVersion = Objects.requireNonNull(b.appVersion, "appVersion");
            this.snapshotBuilder = Objects.requireNonNull(b.snapshotBuilder, "snapshotBuilder");
            this.preferences = Objects.requireNonNull(b.preferences, "preferences");
            this.storageDriver = b.storageDriver;
            this.nativeExport = b.nativeExport;
            this.fileSystem = b.fileSystem;
            this.mapper = b.mapper == null ? Archive.newMapper() : b.mapper;
            this.largeFileThreshold = b.largeFileThreshold;
            this.zone = b.zone;
            this.clock = b.clock;
        }

        public static Builder builder() { return new Builder(); }

        public static final class Builder {
            private Platform platform = Platform.ANDROID;
            private String appVersion = "unknown";
            private SnapshotBuilder snapshotBuilder;
            private PreferenceStore preferences;
            private StorageDriver storageDriver;
            private NativeExport nativeExport;
            private NativeFileSystem fileSystem;
            private ObjectMapper mapper;
            private long largeFileThreshold = 50L * 1024 * 1024;
            private ZoneId zone = ZoneOffset.UTC;
            private Clock clock = Clock.systemUTC();

            private Builder() {}

            public Builder platform(Platform v) { platform = v; return this; }
            public Builder appVersion(String v) { appVersion = v; return this; }
            public Builder snapshotBuilder(SnapshotBuilder v) { snapshotBuilder = v; return this; }
            public Builder preferences(PreferenceStore v) { preferences = v; return this; }
            public Builder storageDriver(StorageDriver v) { storageDriver = v; return this; }
            public Builder nativeExport(NativeExport v) { nativeExport = v; return this; }
            public Builder fileSystem(NativeFileSystem v) { fileSystem = v; return this; }
            public Builder mapper(ObjectMapper v) { mapper = v; return this; }
            public Builder largeFileThreshold(long v) { largeFileThreshold = v; return this; }
            public Builder zone(ZoneId v) { zone = Objects.requireNonNull(v, "zone"); return this; }
            public Builder clock(Clock v) { clock = Objects.requireNonNull(v, "clock"); return this; }
            public ArchivePackager build() { return new ArchivePackager(this); }
        }

        public PackagedArchive pack(BackupOptions options, BackupContext context, Path outputDir) throws IOException {
            return pack(options, context, outputDir, ProgressListener.NONE);
        }

        /**
         * Gera o ZIP em {@code outputDir}. O arquivo é escrito num temporário e renomeado no fim.
         *
         * @throws IllegalArgumentException se {@code context} for nulo
         * @throws IOException se o snapshot falhar ou o ZIP não puder ser escrito
         */
        public PackagedArchive pack(BackupOptions options, BackupContext context, Path outputDir,
                                    ProgressListener listener) throws IOException {
            if (context == null) {
                throw new IllegalArgumentException("Backup context is required");
            }
            Objects.requireNonNull(outputDir, "outputDir");
            BackupOptions opts = options == null ? BackupOptions.defaults() : options;
            ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
            List<String> warnings = new ArrayList<>();
            long createdAt = clock.millis();

            progress.onProgress(ProgressEvent.of(Step.COLLECTING_STATE, "Coletando estado"));
            FullSnapshot snapshot = snapshotBuilder.build(context);
            StorageDriverState driverState = collectDriverState(warnings);
            Map<String, String> prefs = collectPreferences(opts);

            progress.onProgress(ProgressEvent.of(Step.EXPORTING_DB, "Exportando banco"));
            JsonNode relational = exportRelational(warnings);

            Files.createDirectories(outputDir);
            Path tmp = Files.createTempFile(outputDir, "." + BackupFileNames.PREFIX, ".part");
            List<FileManifestEntry> manifest = new ArrayList<>();
            int[] included = {0};
            ArchiveMeta meta;
            try {
                try (ArchiveWriter writer = new ArchiveWriter(tmp, mapper)) {
                    progress.onProgress(ProgressEvent.of(Step.COLLECTING_FILES, "Coletando arquivos"));
                    if (!platform.hasNativeFileSystem() || fileSystem == null) {
                        warnings.add("native-file-folders-unavailable-on-web");
                    } else {
                        for (ContentRoot root : ContentRoot.values()) {
                            if (root.enabled(opts)) {
                                collectRoot(root, writer, manifest, warnings, included, progress);
                            }
                        }
                    }

                    progress.onProgress(ProgressEvent.of(Step.ZIPPING, "Compactando"));
                    meta = new ArchiveMeta(Archive.CURRENT_SCHEMA_VERSION, appVersion, createdAt, platform,
                            NOTES, warnings, opts);
                    writer.putJson(Archive.META_ENTRY, meta.toJson(mapper));
                    writer.putJson(Archive.PREFS_ENTRY, prefs);
                    writer.putJson(Archive.SQLITE_ENTRY, relational);
                    writer.putJson(Archive.SNAPSHOT_ENTRY, snapshot);
                    writer.putJson(Archive.DRIVER_STATE_ENTRY, driverState);
                    writer.putJson(Archive.FILES_MANIFEST_ENTRY, manifest);
                }
                Path target = outputDir.resolve(BackupFileNames.format(createdAt, zone));
                // Nome tem resolução de segundos; um segundo backup no mesmo segundo falha em vez de sobrescrever.
                Files.move(tmp, target);
                long size = Files.size(target);
                log.info("Backup empacotado: {} ({} bytes, {} arquivos, {} avisos)",
                        target.getFileName(), size, included[0], warnings.size());
                return new PackagedArchive(target, meta, manifest, included[0], size);
            } finally {
                deleteQuietly(tmp);
            }
        }

        private static void deleteQuietly(Path path) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Não foi possível remover temporário {}: {}", path, e.toString());
            }
        }

        // ---- Coleta ----

        private StorageDriverState collectDriverState(List<String> warnings) {
            if (storageDriver == null) {
                return StorageDriverState.empty();
            }
            try {
                return new StorageDriverState(storageDriver.listJobs(), storageDriver.listQueuedUploads(),
                        storageDriver.listChapterAudioPaths());
            } catch (IOException | RuntimeException e) {
                log.warn("Falha ao exportar estado do storage driver: {}", message(e));
                warnings.add("storage-driver-export-failed:" + message(e));
                return StorageDriverState.empty();
            }
        }

        private Map<String, String> collectPreferences(BackupOptions opts) throws IOException {
            Map<String, String> out = new LinkedHashMap<>();
            for (String key : PreferenceKeys.SAFE_KEYS) {
                preferences.get(key).ifPresent(v -> out.put(key, v));
            }
            out.putAll(preferences.entriesWithPrefix(PreferenceKeys.VIEW_MODE_PREFIX));
            if (opts.includeOAuthTokens()) {
                for (String key : PreferenceKeys.OAUTH_KEYS) {
                    preferences.get(key).ifPresent(v -> out.put(key, v));
                }
            }
            return out;
        }

        private JsonNode exportRelational(List<String> warnings) {
            if (!platform.hasNativeFileSystem()) {
                warnings.add("sqlite-native-export-unavailable-on-web");
                return sentinel("web-fallback").put("reason", "sqlite-native-export-unavailable");
            }
            if (nativeExport == null || !nativeExport.isAvailable()) {
                warnings.add("sqlite-export-unavailable");
                return sentinel("unavailable");
            }
            try {
                JsonNode export = nativeExport.exportJson();
                if (export == null) {
                    warnings.add("sqlite-export-unavailable");
                    return sentinel("unavailable");
                }
                return export;
            } catch (IOException | RuntimeException e) {
                log.warn("Falha no export nativo do banco: {}", message(e));
                warnings.add("sqlite-export-failed:" + message(e));
                return sentinel("native-export-failed");
            }
        }

        private ObjectNode sentinel(String mode) {
            ObjectNode n = mapper.createObjectNode();
            n.put(SENTINEL_MODE, mode);
            return n;
        }

        /** Varredura em largura com fila explícita; cada diretório é listado uma vez. */
        private void collectRoot(ContentRoot root, ArchiveWriter writer, List<FileManifestEntry> manifest,
                                 List<String> warnings, int[] included, ProgressListener progress) throws IOException {
            Deque<String> queue = new ArrayDeque<>();
            queue.add("");
            while (!queue.isEmpty()) {
                String rel = queue.poll();
                String nativeDir = Storage.join(NATIVE_BASE, root.dirName(), rel);
                List<DirEntry> children;
                try {
                    children = fileSystem.list(nativeDir);
                } catch (IOException e) {
                    manifest.add(FileManifestEntry.skipped(zipPath(root, rel), "missing-folder"));
                    warnings.add("missing-folder:" + nativeDir + ":" + message(e));
                    log.debug("Pasta ausente no backup: {}", nativeDir);
                    continue;
                }
                for (DirEntry child : children) {
                    String childRel = Storage.join(rel, child.name());
                    if (child.directory()) {
                        queue.add(childRel);
                        continue;
                    }
                    String nativePath = Storage.join(nativeDir, child.name());
                    String entryName = zipPath(root, childRel);
                    byte[] content;
                    try {
                        content = fileSystem.read(nativePath);
                    } catch (IOException e) {
                        manifest.add(FileManifestEntry.skipped(entryName, message(e)));
                        warnings.add("file-read-failed:" + nativePath + ":" + message(e));
                        continue;
                    }
                    if (content.length > largeFileThreshold) {
                        warnings.add("large-file:" + entryName + ":" + content.length);
                    }
                    writer.putBytes(entryName, content);
                    manifest.add(FileManifestEntry.included(entryName, content.length));
                    included[0]++;
                    progress.onProgress(new ProgressEvent(Step.COLLECTING_FILES, entryName, included[0], 0));
                }
            }
        }

        private static String zipPath(ContentRoot root, String rel) {
            return Archive.FILES_PREFIX + Storage.join(root.dirName(), rel);
        }
    }

    /** Mensagem da exceção, ou o nome da classe quando vazia. */
    public static String message(Throwable e) {
        String m = e.getMessage();
        return m == null || m.isBlank() ? e.getClass().getSimpleName() : m;
    }
}
