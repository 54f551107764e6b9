package com.example.backupengine.restore;

import com.example.backupengine.archive.Archive;
import com.example.backupengine.archive.Archive.ArchiveBundle;
import com.example.backupengine.archive.Archive.ArchiveMeta;
import com.example.backupengine.archive.Archive.ChapterAudioPath;
import com.example.backupengine.archive.Archive.Platform;
import com.example.backupengine.archive.Archive.StorageDriverState;
import com.example.backupengine.archive.ArchiveReader;
import com.example.backupengine.db.Database.LibraryStore;
import com.example.backupengine.db.Database.NativeExport;
import com.example.backupengine.db.Database.StorageDriver;
import com.example.backupengine.library.Library.Attachment;
import com.example.backupengine.library.Library.Book;
import com.example.backupengine.library.Library.Chapter;
import com.example.backupengine.library.Library.FullSnapshot;
import com.example.backupengine.library.Library.JobRecord;
import com.example.backupengine.library.Snapshots;
import com.example.backupengine.packager.PackagerModule;
import com.example.backupengine.prefs.Preferences.PreferenceKeys;
import com.example.backupengine.prefs.Preferences.PreferenceStore;
import com.example.backupengine.progress.Progress.ProgressEvent;
import com.example.backupengine.progress.Progress.ProgressListener;
import com.example.backupengine.progress.Progress.Step;
import com.example.backupengine.storage.Storage;
import com.example.backupengine.storage.Storage.NativeFileSystem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fluxo de restauração de um ZIP de backup para o estado vivo do app.
 * <p>
 * Leitura, metadados e migração são fatais; as etapas seguintes degradam para avisos
 * sempre que existe um caminho alternativo.
 */
public final class Restore {

    private Restore() {}

    /** Estados da máquina de restauração, na ordem em que são percorridos. */
    public enum RestoreState {
        IDLE(null),
        COLLECTING_STATE(Step.COLLECTING_STATE),
        RESTORING_DB(Step.RESTORING_DB),
        RESTORING_PREFS(Step.RESTORING_PREFS),
        RESTORING_FILES(Step.RESTORING_FILES),
        FINALIZING(Step.FINALIZING),
        DONE(Step.DONE),
        FAILED(Step.FAILED);

        private final Step step;

        RestoreState(Step step) { this.step = step; }

        public Step step() { return step; }

        public boolean isTerminal() { return this == DONE || this == FAILED; }
    }

    /** Gancho para o app recarregar o estado depois da restauração. */
    @FunctionalInterface
    public interface RestoreListener {
        RestoreListener NONE = result -> { };

        void onRestoreCompleted(RestoreResult result) throws IOException;
    }

    public static final class RestoreResult {
        private final ArchiveMeta meta;
        private final List<String> warnings;
        private final int booksRestored;
        private final int chaptersRestored;
        private final int filesRestored;
        private final boolean usedSnapshotFallback;

        public RestoreResult(ArchiveMeta meta, List<String> warnings, int booksRestored, int chaptersRestored,
                             int filesRestored, boolean usedSnapshotFallback) {
            this.meta = Objects.requireNonNull(meta, "meta");
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
            this.booksRestored = booksRestored;
            this.chaptersRestored = chaptersRestored;
            this.filesRestored = filesRestored;
            this.usedSnapshotFallback = usedSnapshotFallback;
        }

        /** Metadados já migrados. */
        public ArchiveMeta meta() { return meta; }
        public List<String> warnings() { return warnings; }
        public int booksRestored() { return booksRestored; }
        public int chaptersRestored() { return chaptersRestored; }
        public int filesRestored() { return filesRestored; }
        public boolean usedSnapshotFallback() { return usedSnapshotFallback; }
    }

    // ===== ORQUESTRADOR =====

    public static final class RestoreOrchestrator {
        private static final Logger log = LoggerFactory.getLogger(RestoreOrchestrator.class);

        private final Platform platform;
        private final LibraryStore library;
        private final StorageDriver storageDriver;
        private final NativeExport nativeExport;
        private final PreferenceStore preferences;
        private final NativeFileSystem fileSystem;
        private final ObjectMapper mapper;
        private final SchemaMigrator migrator;
        private final RestoreListener listener;
        private final Clock clock;
        private final AtomicReference<RestoreState> state = new AtomicReference<>(RestoreState.IDLE);

        private RestoreOrchestrator(Builder b) {
            this.platform = Objects.requireNonNull(b.platform, "platform");
            this.library = Objects.requireNonNull(b.library, "library");
            this.preferences = Objects.requireNonNull(b.preferences, "preferences");
            this.storageDriver = b.storageDriver;
            this.nativeExport = b.nativeExport;
            this.fileSystem = b.fileSystem;
            this.mapper = b.mapper == null ? Archive.newMapper() : b.mapper;
            this.migrator = b.migrator == null ? new SchemaMigrator() : b.migrator;
            this.listener = b.listener == null ? RestoreListener.NONE : b.listener;
            this.clock = b.clock;
        }

        public static Builder builder() { return new Builder(); }

        public static final class Builder {
            private Platform platform = Platform.ANDROID;
            private LibraryStore library;
            private StorageDriver storageDriver;
            private NativeExport nativeExport;
            private PreferenceStore preferences;
            private NativeFileSystem fileSystem;
            private ObjectMapper mapper;
            private SchemaMigrator migrator;
            private RestoreListener listener;
            private Clock clock = Clock.systemUTC();

            private Builder() {}

            public Builder platform(Platform v) { platform = v; return this; }
            public Builder library(LibraryStore v) { library = v; return this; }
            public Builder storageDriver(StorageDriver v) { storageDriver = v; return this; }
            public Builder nativeExport(NativeExport v) { nativeExport = v; return this; }
            public Builder preferences(PreferenceStore v) { preferences = v; return this; }
            public Builder fileSystem(NativeFileSystem v) { fileSystem = v; return this; }
            public Builder mapper(ObjectMapper v) { mapper = v; return this; }
            public Builder migrator(SchemaMigrator v) { migrator = v; return this; }
            public Builder listener(RestoreListener v) { listener = v; return this; }
            public Builder clock(Clock v) { clock = Objects.requireNonNull(v, "clock"); return this; }
            public RestoreOrchestrator build() { return new RestoreOrchestrator(this); }
        }

        /** Estado atual (ou final) da última restauração. */
        public RestoreState state() {
            return state.get();
        }

        public RestoreResult restore(Path archive) throws IOException {
            return restore(archive, ProgressListener.NONE);
        }

        /**
         * Substitui o estado vivo pelo conteúdo do arquivo.
         *
         * @throws com.example.backupengine.archive.ArchiveFormatException arquivo ilegível ou incompleto
         * @throws UnsupportedSchemaException backup de schema mais novo
         */
        public RestoreResult restore(Path archive, ProgressListener listener) throws IOException {
            Objects.requireNonNull(archive, "archive");
            ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
            try {
                return run(archive, progress);
            } catch (IOException | RuntimeException e) {
                enter(RestoreState.FAILED, progress, PackagerModule.message(e));
                log.error("Falha na restauração de {}: {}", archive.getFileName(), e.getMessage());
                throw e;
            }
        }

        private RestoreResult run(Path archive, ProgressListener progress) throws IOException {
            List<String> warnings = new ArrayList<>();
            enter(RestoreState.COLLECTING_STATE, progress, "Lendo backup");

            try (ArchiveReader reader = ArchiveReader.open(archive, mapper)) {
                ArchiveBundle read = reader.readBundle(warnings);
                ArchiveBundle bundle = migrator.migrate(read);
                if (bundle != read) {
                    List<String> metaWarnings = bundle.meta().warnings();
                    warnings.add(metaWarnings.get(metaWarnings.size() - 1));
                }
                FullSnapshot snapshot = bundle.fullSnapshot();

                enter(RestoreState.RESTORING_DB, progress, "Restaurando banco");
                int[] counts = {0, 0};
                boolean fallback = restoreDatabase(bundle, snapshot, warnings, counts);

                enter(RestoreState.RESTORING_PREFS, progress, "Restaurando preferências");
                restorePreferences(bundle, snapshot, warnings);

                enter(RestoreState.RESTORING_FILES, progress, "Restaurando arquivos");
                int files = restoreFiles(reader, bundle.fileEntries(), warnings, progress);
                bundle.storageDriverState().ifPresent(s -> restoreDriverState(s, warnings));

                enter(RestoreState.FINALIZING, progress, "Finalizando");
                persistWarnings(warnings);
                RestoreResult result = new RestoreResult(bundle.meta(), warnings, counts[0], counts[1], files, fallback);
                this.listener.onRestoreCompleted(result);

                enter(RestoreState.DONE, progress, "Restauração concluída");
                log.info("Restauração concluída: {} livros, {} capítulos, {} arquivos, {} avisos (fallback={})",
                        counts[0], counts[1], files, warnings.size(), fallback);
                return result;
            }
        }

        private void enter(RestoreState next, ProgressListener progress, String message) {
            state.set(next);
            if (next.step() != null) {
                progress.onProgress(ProgressEvent.of(next.step(), message));
            }
        }

        // ---- Banco ----

        /** @return true quando o replay do snapshot foi usado */
        private boolean restoreDatabase(ArchiveBundle bundle, FullSnapshot snapshot, List<String> warnings, int[] counts) {
            JsonNode export = bundle.relationalExport().orElse(null);
            boolean nativeUsable = export != null
                    && !PackagerModule.isSentinel(export)
                    && platform.hasNativeFileSystem()
                    && nativeExport != null
                    && nativeExport.isAvailable();
            if (nativeUsable) {
                if (!nativeExport.isJsonValid(export)) {
                    warnings.add("sqlite-json-invalid-falling-back-to-snapshot");
                } else {
                    try {
                        nativeExport.importJson(export);
                        counts[0] = snapshot.books.size();
                        counts[1] = snapshot.chapters.size();
                        log.debug("Export nativo importado");
                        return false;
                    } catch (IOException | RuntimeException e) {
                        log.warn("Falha ao importar export nativo, usando snapshot: {}", e.getMessage());
                        warnings.add("sqlite-import-failed:" + PackagerModule.message(e));
                    }
                }
            }
            replaySnapshot(snapshot, warnings, counts);
            return true;
        }

        /**
         * Caminho de último recurso: cada livro com seus capítulos em lote, depois os anexos agrupados
         * por livro. Capítulos sem livro no snapshot não são gravados e viram aviso.
         */
        private void replaySnapshot(FullSnapshot snapshot, List<String> warnings, int[] counts) {
            Map<String, List<Chapter>> chapters = Snapshots.chaptersByBook(snapshot.chapters);
            Map<String, List<Attachment>> attachments = Snapshots.attachmentsByBook(snapshot.attachments);
            Set<String> bookIds = new HashSet<>();
            for (Book book : snapshot.books) {
                if (book == null || book.id == null) continue;
                bookIds.add(book.id);
                try {
                    library.upsertBook(book);
                    List<Chapter> bookChapters = chapters.getOrDefault(book.id, List.of());
                    if (!bookChapters.isEmpty()) {
                        library.bulkUpsertChapters(book.id, bookChapters);
                    }
                    counts[0]++;
                    counts[1] += bookChapters.size();
                } catch (IOException | RuntimeException e) {
                    log.warn("Falha ao restaurar livro {} do snapshot: {}", book.id, e.getMessage());
                    warnings.add("snapshot-book-restore-failed:" + book.id + ":" + PackagerModule.message(e));
                }
            }
            for (Map.Entry<String, List<Chapter>> e : chapters.entrySet()) {
                if (!bookIds.contains(e.getKey())) {
                    log.warn("{} capítulos do snapshot sem livro {}", e.getValue().size(), e.getKey());
                    warnings.add("snapshot-orphan-chapters:" + e.getKey() + ":" + e.getValue().size());
                }
            }
            for (Map.Entry<String, List<Attachment>> e : attachments.entrySet()) {
                try {
                    library.upsertAttachments(e.getKey(), e.getValue());
                } catch (IOException | RuntimeException ex) {
                    log.warn("Falha ao restaurar anexos do livro {}: {}", e.getKey(), ex.getMessage());
                    warnings.add("snapshot-attachments-restore-failed:" + e.getKey() + ":" + PackagerModule.message(ex));
                }
            }
        }

        // ---- Preferências ----

        private void restorePreferences(ArchiveBundle bundle, FullSnapshot snapshot, List<String> warnings) {
            Map<String, String> prefs = bundle.prefs().isEmpty() ? snapshot.preferences : bundle.prefs();
            boolean includeOAuth = bundle.meta().options().includeOAuthTokens();
            for (Map.Entry<String, String> e : prefs.entrySet()) {
                if (e.getValue() == null) continue;
                if (PreferenceKeys.isOAuthKey(e.getKey()) && !includeOAuth) {
                    continue;
                }
                try {
                    preferences.set(e.getKey(), e.getValue());
                } catch (IOException | RuntimeException ex) {
                    warnings.add("pref-write-failed:" + e.getKey() + ":" + PackagerModule.message(ex));
                }
            }
        }

        // ---- Arquivos ----

        private int restoreFiles(ArchiveReader reader, List<String> entries, List<String> warnings,
                                 ProgressListener progress) {
            if (!platform.hasNativeFileSystem() || fileSystem == null) {
                warnings.add("native-files-restore-skipped-on-web");
                return 0;
            }
            int restored = 0;
            for (String entry : entries) {
                String rel = entry.substring(Archive.FILES_PREFIX.length());
                if (!isSafeRelative(rel)) {
                    log.warn("Entrada recusada na restauração: {}", entry);
                    warnings.add("file-restore-rejected:" + entry);
                    continue;
                }
                String target = Storage.join(PackagerModule.NATIVE_BASE, rel);
                try {
                    int slash = target.lastIndexOf('/');
                    if (slash > 0) {
                        fileSystem.mkdirs(target.substring(0, slash));
                    }
                    try (InputStream in = reader.openEntry(entry)) {
                        fileSystem.write(target, in);
                    }
                    restored++;
                    progress.onProgress(new ProgressEvent(Step.RESTORING_FILES, target, restored, entries.size()));
                } catch (IOException | RuntimeException e) {
                    warnings.add("file-restore-failed:" + target + ":" + PackagerModule.message(e));
                }
            }
            return restored;
        }

        /** Recusa caminhos absolutos, com barra invertida ou com segmentos "..". */
        static boolean isSafeRelative(String rel) {
            if (rel.isEmpty() || rel.startsWith("/") || rel.indexOf('\\') >= 0) {
                return false;
            }
            for (String segment : rel.split("/")) {
                if (segment.equals("..")) return false;
            }
            return true;
        }

        // ---- Estado do driver ----

        private void restoreDriverState(StorageDriverState s, List<String> warnings) {
            if (storageDriver == null) return;
            for (JobRecord job : s.jobs) {
                try {
                    storageDriver.createJob(job);
                } catch (IOException | RuntimeException e) {
                    warnings.add("driver-state-restore-failed:job:" + PackagerModule.message(e));
                }
            }
            for (ChapterAudioPath path : s.chapterAudioPaths) {
                try {
                    storageDriver.setChapterAudioPath(path);
                } catch (IOException | RuntimeException e) {
                    warnings.add("driver-state-restore-failed:chapter-audio-path:" + PackagerModule.message(e));
                }
            }
            for (ObjectNode upload : s.queuedUploads) {
                try {
                    storageDriver.enqueueUpload(upload);
                } catch (IOException | RuntimeException e) {
                    warnings.add("driver-state-restore-failed:queued-upload:" + PackagerModule.message(e));
                }
            }
        }

        // ---- Finalização ----

        private void persistWarnings(List<String> warnings) {
            ObjectNode record = mapper.createObjectNode();
            record.put("restoredAt", clock.millis());
            ArrayNode list = record.putArray("warnings");
            warnings.forEach(list::add);
            try {
                preferences.set(PreferenceKeys.RESTORE_WARNINGS, mapper.writeValueAsString(record));
            } catch (IOException | RuntimeException e) {
                log.warn("Falha ao gravar avisos da restauração: {}", e.getMessage());
                warnings.add("pref-write-failed:" + PreferenceKeys.RESTORE_WARNINGS + ":" + PackagerModule.message(e));
            }
        }
    }
}
