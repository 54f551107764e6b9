package com.example.backupengine.library;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Modelo de domínio serializado no backup: livros, capítulos, anexos, jobs e o snapshot completo.
 * <p>
 * As classes são DTOs mutáveis (campos públicos) porque circulam entre Jackson, o store relacional
 * e o reconciliador; quem precisa preservar o original usa {@code copy()}.
 */
public final class Library {

    private Library() {}

    public enum AudioStatus {
        @JsonEnumDefaultValue
        NONE,
        PENDING,
        GENERATING,
        READY,
        FAILED
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Book {
        public String id;
        public String title;
        public String author;
        public String driveFolderId;
        public String currentChapterId;
        public JsonNode settings;
        public JsonNode rules;
        public Long createdAt;
        public Long updatedAt;

        public Book() {
            // Jackson
        }

        public Book(String id, String title) {
            this.id = id;
            this.title = title;
        }

        public Book copy() {
            Book b = new Book(id, title);
            b.author = author;
            b.driveFolderId = driveFolderId;
            b.currentChapterId = currentChapterId;
            b.settings = settings != null ? settings.deepCopy() : null;
            b.rules = rules != null ? rules.deepCopy() : null;
            b.createdAt = createdAt;
            b.updatedAt = updatedAt;
            return b;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Chapter {
        public String id;
        public String bookId;
        public int index;
        public String title;
        public String volumeName;
        public Integer volumeLocalChapter;
        public String sourceUrl;
        public String content;
        public Integer wordCount;
        public Double progress;
        public String textFileName;
        public String audioFileName;
        public String cloudTextFileId;
        public String cloudAudioFileId;
        public boolean hasTextOnDrive;
        public AudioStatus audioStatus = AudioStatus.NONE;
        public Long updatedAt;

        public Chapter() {
            // Jackson
        }

        public Chapter(String id, String bookId, int index, String title) {
            this.id = id;
            this.bookId = bookId;
            this.index = index;
            this.title = title;
        }

        public Chapter copy() {
            Chapter c = new Chapter(id, bookId, index, title);
            c.volumeName = volumeName;
            c.volumeLocalChapter = volumeLocalChapter;
            c.sourceUrl = sourceUrl;
            c.content = content;
            c.wordCount = wordCount;
            c.progress = progress;
            c.textFileName = textFileName;
            c.audioFileName = audioFileName;
            c.cloudTextFileId = cloudTextFileId;
            c.cloudAudioFileId = cloudAudioFileId;
            c.hasTextOnDrive = hasTextOnDrive;
            c.audioStatus = audioStatus;
            c.updatedAt = updatedAt;
            return c;
        }

        @Override
        public String toString() {
            return "Chapter{" + id + " #" + index + " '" + title + "'}";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Attachment {
        public String id;
        public String bookId;
        public String filename;
        public String mimeType;
        public Long sizeBytes;
        public String localPath;
        public String driveFileId;
        public Long createdAt;
        public Long updatedAt;

        public Attachment() {
            // Jackson
        }

        public Attachment(String id, String bookId, String filename) {
            this.id = id;
            this.bookId = bookId;
            this.filename = filename;
        }

        public Attachment copy() {
            Attachment a = new Attachment(id, bookId, filename);
            a.mimeType = mimeType;
            a.sizeBytes = sizeBytes;
            a.localPath = localPath;
            a.driveFileId = driveFileId;
            a.createdAt = createdAt;
            a.updatedAt = updatedAt;
            return a;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class JobRecord {
        public String id;
        public String type;
        public String status;
        public JsonNode payload;
        public JsonNode progress;
        public String error;
        public Long createdAt;
        public Long updatedAt;

        public JobRecord() {
            // Jackson
        }

        public JobRecord(String id, String type, String status) {
            this.id = id;
            this.type = type;
            this.status = status;
        }

        public JobRecord copy() {
            JobRecord j = new JobRecord(id, type, status);
            j.payload = payload != null ? payload.deepCopy() : null;
            j.progress = progress != null ? progress.deepCopy() : null;
            j.error = error;
            j.createdAt = createdAt;
            j.updatedAt = updatedAt;
            return j;
        }
    }

    /** Snapshot completo do estado durável (state/fullSnapshot.json). */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FullSnapshot {
        public static final int SCHEMA_VERSION = 1;

        public int schemaVersion = SCHEMA_VERSION;
        public long createdAt;
        public String appVersion;
        public Map<String, String> preferences = new LinkedHashMap<>();
        public JsonNode readerProgress;
        public JsonNode legacyProgressStore;
        public JsonNode globalRules;
        public List<Book> books = new ArrayList<>();
        public List<Chapter> chapters = new ArrayList<>();
        public List<Attachment> attachments = new ArrayList<>();
        public List<JobRecord> jobs = new ArrayList<>();
        public JsonNode uiState;

        public FullSnapshot() {
            // Jackson
        }
    }

    /**
     * Entrada do empacotador: o estado vivo da aplicação no momento do backup.
     */
    public static final class BackupContext {
        private final List<Book> books;
        private final List<Chapter> chapters;
        private final List<Attachment> attachments;
        private final List<JobRecord> jobs;
        private final Map<String, String> preferences;
        private final JsonNode readerProgress;
        private final JsonNode legacyProgressStore;
        private final JsonNode globalRules;
        private final JsonNode uiState;

        private BackupContext(Builder b) {
            this.books = Collections.unmodifiableList(new ArrayList<>(b.books));
            this.chapters = Collections.unmodifiableList(new ArrayList<>(b.chapters));
            this.attachments = Collections.unmodifiableList(new ArrayList<>(b.attachments));
            this.jobs = Collections.unmodifiableList(new ArrayList<>(b.jobs));
            this.preferences = Collections.unmodifiableMap(new LinkedHashMap<>(b.preferences));
            this.readerProgress = b.readerProgress;
            this.legacyProgressStore = b.legacyProgressStore;
            this.globalRules = b.globalRules;
            this.uiState = b.uiState;
        }

        public List<Book> books() { return books; }
        public List<Chapter> chapters() { return chapters; }
        public List<Attachment> attachments() { return attachments; }
        public List<JobRecord> jobs() { return jobs; }
        public Map<String, String> preferences() { return preferences; }
        public JsonNode readerProgress() { return readerProgress; }
        public JsonNode legacyProgressStore() { return legacyProgressStore; }
        public JsonNode globalRules() { return globalRules; }
        public JsonNode uiState() { return uiState; }

        public static Builder builder() { return new Builder(); }

        public static final class Builder {
            private List<Book> books = List.of();
            private List<Chapter> chapters = List.of();
            private List<Attachment> attachments = List.of();
            private List<JobRecord> jobs = List.of();
            private Map<String, String> preferences = Map.of();
            private JsonNode readerProgress;
            private JsonNode legacyProgressStore;
            private JsonNode globalRules;
            private JsonNode uiState;

            public Builder books(List<Book> v) { books = Objects.requireNonNull(v, "books"); return this; }
            public Builder chapters(List<Chapter> v) { chapters = Objects.requireNonNull(v, "chapters"); return this; }
            public Builder attachments(List<Attachment> v) { attachments = Objects.requireNonNull(v, "attachments"); return this; }
            public Builder jobs(List<JobRecord> v) { jobs = Objects.requireNonNull(v, "jobs"); return this; }
            public Builder preferences(Map<String, String> v) { preferences = Objects.requireNonNull(v, "preferences"); return this; }
            public Builder readerProgress(JsonNode v) { readerProgress = v; return this; }
            public Builder legacyProgressStore(JsonNode v) { legacyProgressStore = v; return this; }
            public Builder globalRules(JsonNode v) { globalRules = v; return this; }
            public Builder uiState(JsonNode v) { uiState = v; return this; }
            public BackupContext build() { return new BackupContext(this); }
        }
    }
}
