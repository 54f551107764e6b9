package com.example.backupengine.db;

import com.example.backupengine.archive.Archive.ChapterAudioPath;
import com.example.backupengine.library.Library.Attachment;
import com.example.backupengine.library.Library.Book;
import com.example.backupengine.library.Library.Chapter;
import com.example.backupengine.library.Library.JobRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seams do armazenamento relacional consumidos pelo motor e uma implementação em documento JSON.
 */
public final class Database {

    private Database() {}

    /** Livros, capítulos e anexos. */
    public interface LibraryStore {
        void upsertBook(Book book) throws IOException;

        void bulkUpsertChapters(String bookId, List<Chapter> chapters) throws IOException;

        void upsertAttachments(String bookId, List<Attachment> attachments) throws IOException;

        List<Book> listBooks() throws IOException;

        /** Capítulos do livro ordenados por índice. */
        List<Chapter> listChapters(String bookId) throws IOException;

        /** Página de capítulos com índice maior que {@code afterIndex} (null = início). */
        List<Chapter> listChaptersPage(String bookId, Integer afterIndex, int limit) throws IOException;

        List<Attachment> listAttachments() throws IOException;
    }

    /** Estado adjacente mantido pelo storage driver. */
    public interface StorageDriver {
        List<JobRecord> listJobs() throws IOException;

        /** Idempotente por id. */
        void createJob(JobRecord job) throws IOException;

        List<ObjectNode> listQueuedUploads() throws IOException;

        /** Idempotente pelo campo "id" quando presente. */
        void enqueueUpload(ObjectNode upload) throws IOException;

        List<ChapterAudioPath> listChapterAudioPaths() throws IOException;

        void setChapterAudioPath(ChapterAudioPath path) throws IOException;
    }

    /** Export/import nativo do banco inteiro. */
    public interface NativeExport {
        boolean isAvailable();

        JsonNode exportJson() throws IOException;

        void importJson(JsonNode export) throws IOException;

        /** Checagem estrutural feita antes do import. */
        boolean isJsonValid(JsonNode export);
    }

    // ===== DOCUMENTO JSON =====

    /**
     * Banco em um único documento JSON, opcionalmente persistido em arquivo. Serve ao CLI e aos testes.
     */
    public static final class JsonDocumentStore implements LibraryStore, StorageDriver, NativeExport {
        private static final Logger log = LoggerFactory.getLogger(JsonDocumentStore.class);

        public static final String FORMAT = "talevox-db";
        public static final int VERSION = 1;

        private final Path file;
        private final ObjectMapper mapper;
        private Document doc = new Document();

        /** Store só em memória. */
        public JsonDocumentStore(ObjectMapper mapper) {
            this.file = null;
            this.mapper = Objects.requireNonNull(mapper, "mapper");
        }

        public JsonDocumentStore(Path file, ObjectMapper mapper) throws IOException {
            this.file = Objects.requireNonNull(file, "file");
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            if (Files.exists(file)) {
                this.doc = mapper.readValue(file.toFile(), Document.class);
                log.debug("Banco carregado de {}: {} livros", file, doc.books.size());
            }
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        public static final class Document {
            public String format = FORMAT;
            public int version = VERSION;
            public List<Book> books = new ArrayList<>();
            public List<Chapter> chapters = new ArrayList<>();
            public List<Attachment> attachments = new ArrayList<>();
            public List<JobRecord> jobs = new ArrayList<>();
            public List<ObjectNode> queuedUploads = new ArrayList<>();
            public List<ChapterAudioPath> chapterAudioPaths = new ArrayList<>();

            public Document() {
                // Jackson
            }
        }

        // ---- LibraryStore ----

        @Override
        public synchronized void upsertBook(Book book) throws IOException {
            Objects.requireNonNull(book, "book");
            replaceById(doc.books, book.copy(), b -> b.id);
            flush();
        }

        @Override
        public synchronized void bulkUpsertChapters(String bookId, List<Chapter> chapters) throws IOException {
            for (Chapter c : chapters) {
                Chapter copy = c.copy();
                copy.bookId = bookId;
                replaceById(doc.chapters, copy, ch -> ch.id);
            }
            flush();
        }

        @Override
        public synchronized void upsertAttachments(String bookId, List<Attachment> attachments) throws IOException {
            for (Attachment a : attachments) {
                Attachment copy = a.copy();
                copy.bookId = bookId;
                replaceById(doc.attachments, copy, at -> at.id);
            }
            flush();
        }

        @Override
        public synchronized List<Book> listBooks() {
            List<Book> out = new ArrayList<>();
            doc.books.forEach(b -> out.add(b.copy()));
            return out;
        }

        @Override
        public synchronized List<Chapter> listChapters(String bookId) {
            return listChaptersPage(bookId, null, Integer.MAX_VALUE);
        }

        @Override
        public synchronized List<Chapter> listChaptersPage(String bookId, Integer afterIndex, int limit) {
            List<Chapter> out = new ArrayList<>();
            for (Chapter c : doc.chapters) {
                if (Objects.equals(bookId, c.bookId) && (afterIndex == null || c.index > afterIndex)) {
                    out.add(c.copy());
                }
            }
            out.sort(Comparator.comparingInt(c -> c.index));
            return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
        }

        @Override
        public synchronized List<Attachment> listAttachments() {
            List<Attachment> out = new ArrayList<>();
            doc.attachments.forEach(a -> out.add(a.copy()));
            return out;
        }

        // ---- StorageDriver ----

        @Override
        public synchronized List<JobRecord> listJobs() {
            List<JobRecord> out = new ArrayList<>();
            doc.jobs.forEach(j -> out.add(j.copy()));
            return out;
        }

        @Override
        public synchronized void createJob(JobRecord job) throws IOException {
            Objects.requireNonNull(job.id, "job.id");
            replaceById(doc.jobs, job.copy(), j -> j.id);
            flush();
        }

        @Override
        public synchronized List<ObjectNode> listQueuedUploads() {
            List<ObjectNode> out = new ArrayList<>();
            doc.queuedUploads.forEach(u -> out.add(u.deepCopy()));
            return out;
        }

        @Override
        public synchronized void enqueueUpload(ObjectNode upload) throws IOException {
            Objects.requireNonNull(upload, "upload");
            if (upload.hasNonNull("id")) {
                replaceById(doc.queuedUploads, upload.deepCopy(), u -> u.path("id").asText(null));
            } else {
                doc.queuedUploads.add(upload.deepCopy());
            }
            flush();
        }

        @Override
        public synchronized List<ChapterAudioPath> listChapterAudioPaths() {
            List<ChapterAudioPath> out = new ArrayList<>();
            doc.chapterAudioPaths.forEach(p -> out.add(p.copy()));
            return out;
        }

        @Override
        public synchronized void setChapterAudioPath(ChapterAudioPath path) throws IOException {
            Objects.requireNonNull(path.chapterId, "chapterId");
            replaceById(doc.chapterAudioPaths, path.copy(), p -> p.chapterId);
            flush();
        }

        // ---- NativeExport ----

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public synchronized JsonNode exportJson() {
            return mapper.valueToTree(doc);
        }

        @Override
        public synchronized void importJson(JsonNode export) throws IOException {
            if (!isJsonValid(export)) {
                throw new IOException("Export do banco inválido");
            }
            try {
                doc = mapper.treeToValue(export, Document.class);
            } catch (IOException e) {
                throw new IOException("Falha ao importar export do banco: " + e.getMessage(), e);
            }
            log.info("Banco importado: {} livros, {} capítulos", doc.books.size(), doc.chapters.size());
            flush();
        }

        @Override
        public boolean isJsonValid(JsonNode export) {
            if (export == null || !export.isObject()) return false;
            if (!FORMAT.equals(export.path("format").asText(null))) return false;
            if (!export.path("version").isInt() || export.get("version").intValue() > VERSION) return false;
            for (String table : List.of("books", "chapters")) {
                if (!export.path(table).isArray()) return false;
            }
            return true;
        }

        private void flush() throws IOException {
            if (file == null) return;
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), doc);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }

        private static <T> void replaceById(List<T> items, T item, Function<T, String> id) {
            String key = id.apply(item);
            for (int i = 0; i < items.size(); i++) {
                if (Objects.equals(key, id.apply(items.get(i)))) {
                    items.set(i, item);
                    return;
                }
            }
            items.add(item);
        }
    }
}
