package com.example.backupengine.archive;

import com.example.backupengine.library.Library.FullSnapshot;
import com.example.backupengine.library.Library.JobRecord;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Formato do arquivo de backup: nomes de entradas, metadados, opções, manifesto de arquivos
 * e o bundle lido de volta na restauração.
 */
public final class Archive {

    private Archive() {}

    /** Prefixo do produto usado em nomes de arquivo, pastas e chaves de preferência. */
    public static final String PRODUCT = "talevox";

    /** Versão atual do schema do backup (meta.backupSchemaVersion). */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    // ---- Nomes das entradas ----------------------------------------------

    public static final String META_ENTRY = "meta.json";
    public static final String PREFS_ENTRY = "prefs.json";
    public static final String SQLITE_ENTRY = "sqlite.json";
    public static final String DB_EXPORT_ENTRY = "db-export.json";
    public static final String SNAPSHOT_ENTRY = "state/fullSnapshot.json";
    public static final String DRIVER_STATE_ENTRY = "state/storageDriver.json";
    public static final String FILES_MANIFEST_ENTRY = "manifests/files.json";
    public static final String FILES_PREFIX = "files/";

    /** ObjectMapper configurado para todas as entradas JSON do arquivo. */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    // ---- Plataforma ------------------------------------------------------

    public enum Platform {
        WEB("web", false),
        ANDROID("android", true),
        IOS("ios", true);

        private final String wireName;
        private final boolean nativeFileSystem;

        Platform(String wireName, boolean nativeFileSystem) {
            this.wireName = wireName;
            this.nativeFileSystem = nativeFileSystem;
        }

        public String wireName() { return wireName; }

        /** Plataformas web não têm filesystem nativo nem export SQLite nativo. */
        public boolean hasNativeFileSystem() { return nativeFileSystem; }

        /** Leitura tolerante: android/ios; qualquer outro valor vira web. */
        public static Platform fromWire(String raw) {
            if ("android".equals(raw)) return ANDROID;
            if ("ios".equals(raw)) return IOS;
            return WEB;
        }
    }

    // ---- Opções ----------------------------------------------------------

    public static final class BackupOptions {
        private final boolean includeAudio;
        private final boolean includeDiagnostics;
        private final boolean includeAttachments;
        private final boolean includeChapterText;
        private final boolean includeOAuthTokens;

        public BackupOptions(boolean includeAudio, boolean includeDiagnostics, boolean includeAttachments,
                             boolean includeChapterText, boolean includeOAuthTokens) {
            this.includeAudio = includeAudio;
            this.includeDiagnostics = includeDiagnostics;
            this.includeAttachments = includeAttachments;
            this.includeChapterText = includeChapterText;
            this.includeOAuthTokens = includeOAuthTokens;
        }

        public static BackupOptions defaults() {
            return new BackupOptions(true, true, true, true, false);
        }

        /**
         * Normalização tolerante: as quatro primeiras só ficam falsas com {@code false} literal;
         * tokens OAuth só entram com {@code true} literal.
         */
        public static BackupOptions normalize(JsonNode node) {
            if (node == null || !node.isObject()) {
                return defaults();
            }
            return new BackupOptions(
                    notFalse(node.get("includeAudio")),
                    notFalse(node.get("includeDiagnostics")),
                    notFalse(node.get("includeAttachments")),
                    notFalse(node.get("includeChapterText")),
                    node.path("includeOAuthTokens").isBoolean() && node.get("includeOAuthTokens").booleanValue());
        }

        private static boolean notFalse(JsonNode v) {
            return v == null || !v.isBoolean() || v.booleanValue();
        }

        public boolean includeAudio() { return includeAudio; }
        public boolean includeDiagnostics() { return includeDiagnostics; }
        public boolean includeAttachments() { return includeAttachments; }
        public boolean includeChapterText() { return includeChapterText; }
        public boolean includeOAuthTokens() { return includeOAuthTokens; }

        public BackupOptions withOAuthTokens(boolean include) {
            return new BackupOptions(includeAudio, includeDiagnostics, includeAttachments, includeChapterText, include);
        }

        public ObjectNode toJson(ObjectMapper mapper) {
            ObjectNode n = mapper.createObjectNode();
            n.put("includeAudio", includeAudio);
            n.put("includeDiagnostics", includeDiagnostics);
            n.put("includeAttachments", includeAttachments);
            n.put("includeChapterText", includeChapterText);
            n.put("includeOAuthTokens", includeOAuthTokens);
            return n;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BackupOptions)) return false;
            BackupOptions that = (BackupOptions) o;
            return includeAudio == that.includeAudio && includeDiagnostics == that.includeDiagnostics
                    && includeAttachments == that.includeAttachments && includeChapterText == that.includeChapterText
                    && includeOAuthTokens == that.includeOAuthTokens;
        }

        @Override
        public int hashCode() {
            return Objects.hash(includeAudio, includeDiagnostics, includeAttachments, includeChapterText, includeOAuthTokens);
        }
    }

    // ---- Metadados -------------------------------------------------------

    /** Conteúdo de meta.json. Imutável; avisos só crescem via {@link #withWarning(String)}. */
    public static final class ArchiveMeta {
        private final int schemaVersion;
        private final String appVersion;
        private final long createdAt;
        private final Platform platform;
        private final String notes;
        private final List<String> warnings;
        private final BackupOptions options;

        public ArchiveMeta(int schemaVersion, String appVersion, long createdAt, Platform platform,
                           String notes, List<String> warnings, BackupOptions options) {
            this.schemaVersion = schemaVersion;
            this.appVersion = Objects.requireNonNull(appVersion, "appVersion");
            this.createdAt = createdAt;
            this.platform = Objects.requireNonNull(platform, "platform");
            this.notes = notes == null ? "" : notes;
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
            this.options = Objects.requireNonNull(options, "options");
        }

        public int schemaVersion() { return schemaVersion; }
        public String appVersion() { return appVersion; }
        public long createdAt() { return createdAt; }
        public Platform platform() { return platform; }
        public String notes() { return notes; }
        public List<String> warnings() { return warnings; }
        public BackupOptions options() { return options; }

        public ArchiveMeta withSchemaVersion(int version) {
            return new ArchiveMeta(version, appVersion, createdAt, platform, notes, warnings, options);
        }

        public ArchiveMeta withWarning(String warning) {
            List<String> next = new ArrayList<>(warnings);
            next.add(warning);
            return new ArchiveMeta(schemaVersion, appVersion, createdAt, platform, notes, next, options);
        }

        public ObjectNode toJson(ObjectMapper mapper) {
            ObjectNode n = mapper.createObjectNode();
            n.put("backupSchemaVersion", schemaVersion);
            n.put("appVersion", appVersion);
            n.put("createdAt", createdAt);
            n.put("platform", platform.wireName());
            n.put("notes", notes);
            ArrayNode w = n.putArray("warnings");
            warnings.forEach(w::add);
            n.set("options", options.toJson(mapper));
            return n;
        }

        /**
         * Leitura tolerante: só a versão do schema é obrigatória e precisa ser numérica.
         *
         * @throws ArchiveFormatException se a versão estiver ausente ou não for numérica
         */
        public static ArchiveMeta fromJson(JsonNode node) throws ArchiveFormatException {
            if (node == null || !node.isObject() || !node.path("backupSchemaVersion").isNumber()) {
                throw new ArchiveFormatException(META_ENTRY, "Invalid backup metadata.");
            }
            int version = node.get("backupSchemaVersion").intValue();
            String appVersion = node.path("appVersion").asText("");
            long createdAt = node.path("createdAt").isNumber()
                    ? node.get("createdAt").longValue()
                    : parseInstantMillis(node.path("createdAt").asText(null));
            List<String> warnings = new ArrayList<>();
            JsonNode w = node.get("warnings");
            if (w != null && w.isArray()) {
                w.forEach(item -> warnings.add(item.asText()));
            }
            return new ArchiveMeta(version,
                    appVersion.isBlank() ? "unknown" : appVersion,
                    createdAt,
                    Platform.fromWire(node.path("platform").asText(null)),
                    node.path("notes").asText(""),
                    warnings,
                    BackupOptions.normalize(node.get("options")));
        }

        private static long parseInstantMillis(String raw) {
            if (raw == null || raw.isBlank()) return System.currentTimeMillis();
            try {
                return Instant.parse(raw).toEpochMilli();
            } catch (RuntimeException e) {
                return System.currentTimeMillis();
            }
        }
    }

    // ---- Manifesto de arquivos -------------------------------------------

    /** Uma linha do manifests/files.json; skippedReason presente = arquivo registrado mas ausente. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FileManifestEntry {
        private final String path;
        private final long bytes;
        private final String skippedReason;

        @JsonCreator
        public FileManifestEntry(@JsonProperty("path") String path,
                                 @JsonProperty("bytes") long bytes,
                                 @JsonProperty("skippedReason") String skippedReason) {
            this.path = Objects.requireNonNull(path, "path");
            this.bytes = bytes;
            this.skippedReason = skippedReason;
        }

        public static FileManifestEntry included(String path, long bytes) {
            return new FileManifestEntry(path, bytes, null);
        }

        public static FileManifestEntry skipped(String path, String reason) {
            return new FileManifestEntry(path, 0L, reason);
        }

        @JsonProperty("path") public String path() { return path; }
        @JsonProperty("bytes") public long bytes() { return bytes; }
        @JsonProperty("skippedReason") public String skippedReason() { return skippedReason; }

        @JsonIgnore
        public boolean isSkipped() { return skippedReason != null; }
    }

    // ---- Estado do storage driver ----------------------------------------

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ChapterAudioPath {
        public String chapterId;
        public String localPath;
        public long sizeBytes;
        public Long updatedAt;

        public ChapterAudioPath() {
            // Jackson
        }

        public ChapterAudioPath(String chapterId, String localPath, long sizeBytes, Long updatedAt) {
            this.chapterId = chapterId;
            this.localPath = localPath;
            this.sizeBytes = sizeBytes;
            this.updatedAt = updatedAt;
        }

        public ChapterAudioPath copy() {
            return new ChapterAudioPath(chapterId, localPath, sizeBytes, updatedAt);
        }
    }

    /** Estado adjacente ao banco que o export SQL não cobre: jobs, fila de upload e caminhos de áudio. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StorageDriverState {
        public List<JobRecord> jobs = new ArrayList<>();
        public List<ObjectNode> queuedUploads = new ArrayList<>();
        public List<ChapterAudioPath> chapterAudioPaths = new ArrayList<>();

        public StorageDriverState() {
            // Jackson
        }

        public StorageDriverState(List<JobRecord> jobs, List<ObjectNode> queuedUploads,
                                  List<ChapterAudioPath> chapterAudioPaths) {
            this.jobs = new ArrayList<>(jobs);
            this.queuedUploads = new ArrayList<>(queuedUploads);
            this.chapterAudioPaths = new ArrayList<>(chapterAudioPaths);
        }

        public static StorageDriverState empty() {
            return new StorageDriverState();
        }
    }

    // ---- Entradas lidas --------------------------------------------------

    /**
     * Resultado tipado da leitura de uma entrada: presente com valor, ausente, ou inválida com erro.
     */
    public static final class EntryResult<T> {
        public enum Status { PRESENT, ABSENT, INVALID }

        private final String name;
        private final Status status;
        private final T value;
        private final String error;

        private EntryResult(String name, Status status, T value, String error) {
            this.name = name;
            this.status = status;
            this.value = value;
            this.error = error;
        }

        public static <T> EntryResult<T> present(String name, T value) {
            return new EntryResult<>(name, Status.PRESENT, Objects.requireNonNull(value, "value"), null);
        }

        public static <T> EntryResult<T> absent(String name) {
            return new EntryResult<>(name, Status.ABSENT, null, null);
        }

        public static <T> EntryResult<T> invalid(String name, String error) {
            return new EntryResult<>(name, Status.INVALID, null, error);
        }

        public String name() { return name; }
        public Status status() { return status; }
        public Optional<T> value() { return Optional.ofNullable(value); }
        public Optional<String> error() { return Optional.ofNullable(error); }
        public boolean isPresent() { return status == Status.PRESENT; }
    }

    // ---- Bundle ----------------------------------------------------------

    /** Unidade de backup/restore já interpretada. Imutável. */
    public static final class ArchiveBundle {
        private final ArchiveMeta meta;
        private final Map<String, String> prefs;
        private final JsonNode relationalExport;
        private final FullSnapshot fullSnapshot;
        private final StorageDriverState storageDriverState;
        private final List<FileManifestEntry> fileManifest;
        private final List<String> fileEntries;

        public ArchiveBundle(ArchiveMeta meta,
                             Map<String, String> prefs,
                             JsonNode relationalExport,
                             FullSnapshot fullSnapshot,
                             StorageDriverState storageDriverState,
                             List<FileManifestEntry> fileManifest,
                             List<String> fileEntries) {
            this.meta = Objects.requireNonNull(meta, "meta");
            this.prefs = Collections.unmodifiableMap(new LinkedHashMap<>(prefs));
            this.relationalExport = relationalExport;
            this.fullSnapshot = Objects.requireNonNull(fullSnapshot, "fullSnapshot");
            this.storageDriverState = storageDriverState;
            this.fileManifest = List.copyOf(fileManifest);
            this.fileEntries = List.copyOf(fileEntries);
        }

        public ArchiveMeta meta() { return meta; }
        public Map<String, String> prefs() { return prefs; }
        public Optional<JsonNode> relationalExport() { return Optional.ofNullable(relationalExport); }
        public FullSnapshot fullSnapshot() { return fullSnapshot; }
        public Optional<StorageDriverState> storageDriverState() { return Optional.ofNullable(storageDriverState); }
        public List<FileManifestEntry> fileManifest() { return fileManifest; }
        /** Nomes das entradas sob files/ presentes no arquivo. */
        public List<String> fileEntries() { return fileEntries; }

        public ArchiveBundle withMeta(ArchiveMeta next) {
            return new ArchiveBundle(next, prefs, relationalExport, fullSnapshot, storageDriverState, fileManifest, fileEntries);
        }
    }

    // ---- Nomes de artefatos ----------------------------------------------

    public static final class BackupFileNames {
        public static final String PREFIX = PRODUCT + "-backup-";
        public static final String SUFFIX = ".zip";
        /** Ponteiro remoto para o último backup; sobrescrito a cada envio. */
        public static final String POINTER_FILE_NAME = PRODUCT + "-latest-backup.json";

        private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd-HHmmss", Locale.ROOT);
        private static final Pattern ARTIFACT = Pattern.compile(
                Pattern.quote(PREFIX) + "\\d{4}-\\d{2}-\\d{2}-\\d{6}" + Pattern.quote(SUFFIX));

        private BackupFileNames() {}

        public static String format(long createdAtMillis, ZoneId zone) {
            return PREFIX + STAMP.format(Instant.ofEpochMilli(createdAtMillis).atZone(zone)) + SUFFIX;
        }

        /** Só nomes neste padrão são considerados pela retenção. */
        public static boolean isBackupArtifact(String name) {
            return name != null && ARTIFACT.matcher(name).matches();
        }
    }
}
