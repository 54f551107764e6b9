package com.example.backupengine.folders;

import com.example.backupengine.db.Database.LibraryStore;
import com.example.backupengine.library.Library.Book;
import com.example.backupengine.library.Library.Chapter;
import com.example.backupengine.reconcile.ChapterFileNames;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layout de pastas por livro (meta/text/audio/trash) e os manifests book.json / inventory.json,
 * que são o contrato durável entre os metadados locais e o backend de pastas.
 */
public final class FolderManifests {

    private FolderManifests() {}

    public static final String SCHEMA_VERSION = "3.0";
    public static final String META_FOLDER = "meta";
    public static final String TEXT_FOLDER = "text";
    public static final String AUDIO_FOLDER = "audio";
    public static final String TRASH_FOLDER = "trash";
    public static final String BOOK_MANIFEST = "book.json";
    public static final String INVENTORY_MANIFEST = "inventory.json";

    static final int CHAPTER_PAGE_SIZE = 500;

    // ---- Adaptador de pastas ---------------------------------------------

    public enum FolderBackend {
        DRIVE("drive"),
        LOCAL("local");

        private final String wireName;

        FolderBackend(String wireName) { this.wireName = wireName; }

        public String wireName() { return wireName; }
    }

    public static final class FolderRef {
        private final FolderBackend backend;
        private final String id;
        private final String name;

        public FolderRef(FolderBackend backend, String id, String name) {
            this.backend = Objects.requireNonNull(backend, "backend");
            this.id = Objects.requireNonNull(id, "id");
            this.name = name;
        }

        public FolderBackend backend() { return backend; }
        public String id() { return id; }
        public String name() { return name; }
    }

    public static final class FileRef {
        private final FolderBackend backend;
        private final String id;
        private final String name;
        private final boolean folder;
        private final Instant modifiedTime;

        public FileRef(FolderBackend backend, String id, String name, boolean folder, Instant modifiedTime) {
            this.backend = Objects.requireNonNull(backend, "backend");
            this.id = Objects.requireNonNull(id, "id");
            this.name = Objects.requireNonNull(name, "name");
            this.folder = folder;
            this.modifiedTime = modifiedTime;
        }

        public FolderBackend backend() { return backend; }
        public String id() { return id; }
        public String name() { return name; }
        public boolean folder() { return folder; }
        public Optional<Instant> modifiedTime() { return Optional.ofNullable(modifiedTime); }
    }

    /**
     * Backend capaz de pastas. Quando há nomes repetidos, vence o item com modifiedTime mais recente.
     */
    public interface FolderAdapter {
        FolderBackend backend();

        /** Devolve a subpasta existente ou a cria. */
        FolderRef ensureFolder(FolderRef parent, String name) throws IOException;

        List<FileRef> list(FolderRef folder) throws IOException;

        Optional<FileRef> findByName(FolderRef folder, String name) throws IOException;

        String readText(FileRef file) throws IOException;

        /** Cria o arquivo ou sobrescreve {@code existing} quando informado. */
        FileRef writeText(FolderRef folder, String name, String content, FileRef existing) throws IOException;
    }

    /** Índice do item mais recente; empate favorece o último visto. */
    static int pickNewest(List<? extends FileRef> items) {
        int best = 0;
        long bestTime = Long.MIN_VALUE;
        for (int i = 0; i < items.size(); i++) {
            long t = items.get(i).modifiedTime().map(Instant::toEpochMilli).orElse(Long.MIN_VALUE);
            if (t >= bestTime) {
                bestTime = t;
                best = i;
            }
        }
        return best;
    }

    /** Filtra por nome (e opcionalmente só pastas) e escolhe o mais recente. */
    public static Optional<FileRef> newestNamed(List<FileRef> items, String name, boolean foldersOnly) {
        List<FileRef> matches = new ArrayList<>();
        for (FileRef f : items) {
            if (f.name().equals(name) && (!foldersOnly || f.folder())) {
                matches.add(f);
            }
        }
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(pickNewest(matches)));
    }

    // ---- Manifests -------------------------------------------------------

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BookManifest {
        public String schemaVersion = SCHEMA_VERSION;
        public String bookId;
        public String title;
        public long createdAt;
        public String backend;
        public String rootFolderId;
        public Map<String, String> folders = new LinkedHashMap<>();

        public BookManifest() {
            // Jackson
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LegacyRef {
        public int legacyIdx;
        public String legacyTextName;
        public String legacyAudioName;

        public LegacyRef() {
            // Jackson
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class InventoryChapter {
        public String chapterId;
        public int idx;
        public String title;
        public String textName;
        public String audioName;
        public String volumeName;
        public Integer volumeLocalChapter;
        public LegacyRef legacy;

        public InventoryChapter() {
            // Jackson
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class InventoryManifest {
        public String schemaVersion = SCHEMA_VERSION;
        public String bookId;
        public int expectedTotal;
        public List<InventoryChapter> chapters = new ArrayList<>();

        public InventoryManifest() {
            // Jackson
        }

        /** Insere ou substitui pelo chapterId, mantendo as entradas únicas. */
        public void putChapter(InventoryChapter chapter) {
            Objects.requireNonNull(chapter.chapterId, "chapterId");
            for (int i = 0; i < chapters.size(); i++) {
                if (chapter.chapterId.equals(chapters.get(i).chapterId)) {
                    chapters.set(i, chapter);
                    return;
                }
            }
            chapters.add(chapter);
            expectedTotal = Math.max(expectedTotal, chapters.size());
        }
    }

    /** Resultado de {@link FolderManifestInitializer#ensure}. */
    public static final class BookFolderManifests {
        private final Map<String, FolderRef> folders;
        private final BookManifest book;
        private final InventoryManifest inventory;
        private final boolean bookCreated;
        private final boolean inventoryCreated;

        BookFolderManifests(Map<String, FolderRef> folders, BookManifest book, InventoryManifest inventory,
                            boolean bookCreated, boolean inventoryCreated) {
            this.folders = Map.copyOf(folders);
            this.book = book;
            this.inventory = inventory;
            this.bookCreated = bookCreated;
            this.inventoryCreated = inventoryCreated;
        }

        public FolderRef folder(String name) { return folders.get(name); }
        public FolderRef metaFolder() { return folders.get(META_FOLDER); }
        public BookManifest book() { return book; }
        public InventoryManifest inventory() { return inventory; }
        public boolean bookCreated() { return bookCreated; }
        public boolean inventoryCreated() { return inventoryCreated; }
    }

    // ===== INICIALIZADOR =====

    /**
     * Garante o layout de pastas e os manifests de um livro. Idempotente: manifests existentes são
     * lidos, nunca sobrescritos; um manifest ilegível é substituído só em memória pelo padrão.
     */
    public static final class FolderManifestInitializer {
        private static final Logger log = LoggerFactory.getLogger(FolderManifestInitializer.class);

        private final LibraryStore library;
        private final ObjectMapper mapper;
        private final Clock clock;

        public FolderManifestInitializer(LibraryStore library, ObjectMapper mapper) {
            this(library, mapper, Clock.systemUTC());
        }

        public FolderManifestInitializer(LibraryStore library, ObjectMapper mapper, Clock clock) {
            this.library = Objects.requireNonNull(library, "library");
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        public BookFolderManifests ensure(FolderAdapter adapter, FolderRef bookRoot, Book book) throws IOException {
            Objects.requireNonNull(adapter, "adapter");
            Objects.requireNonNull(bookRoot, "bookRoot");
            Objects.requireNonNull(book, "book");

            Map<String, FolderRef> folders = new LinkedHashMap<>();
            for (String name : List.of(META_FOLDER, TEXT_FOLDER, AUDIO_FOLDER, TRASH_FOLDER)) {
                folders.put(name, adapter.ensureFolder(bookRoot, name));
            }
            FolderRef meta = folders.get(META_FOLDER);

            boolean bookCreated = false;
            BookManifest bookManifest;
            Optional<FileRef> existingBook = adapter.findByName(meta, BOOK_MANIFEST);
            if (existingBook.isPresent()) {
                bookManifest = readOr(adapter, existingBook.get(), BookManifest.class)
                        .orElseGet(() -> defaultBookManifest(adapter.backend(), bookRoot, book));
            } else {
                bookManifest = defaultBookManifest(adapter.backend(), bookRoot, book);
                adapter.writeText(meta, BOOK_MANIFEST, mapper.writeValueAsString(bookManifest), null);
                bookCreated = true;
                log.info("book.json criado para o livro {}", book.id);
            }

            boolean inventoryCreated = false;
            InventoryManifest inventory;
            Optional<FileRef> existingInventory = adapter.findByName(meta, INVENTORY_MANIFEST);
            if (existingInventory.isPresent()) {
                Optional<InventoryManifest> parsed = readOr(adapter, existingInventory.get(), InventoryManifest.class);
                inventory = parsed.isPresent() ? parsed.get() : defaultInventory(book);
            } else {
                inventory = defaultInventory(book);
                adapter.writeText(meta, INVENTORY_MANIFEST, mapper.writeValueAsString(inventory), null);
                inventoryCreated = true;
                log.info("inventory.json criado para o livro {} ({} capítulos)", book.id, inventory.chapters.size());
            }

            return new BookFolderManifests(folders, bookManifest, inventory, bookCreated, inventoryCreated);
        }

        /** Grava o inventário sobre o arquivo existente (read-modify-write do chamador). */
        public void saveInventory(FolderAdapter adapter, FolderRef metaFolder, InventoryManifest inventory) throws IOException {
            Optional<FileRef> existing = adapter.findByName(metaFolder, INVENTORY_MANIFEST);
            adapter.writeText(metaFolder, INVENTORY_MANIFEST, mapper.writeValueAsString(inventory), existing.orElse(null));
        }

        private <T> Optional<T> readOr(FolderAdapter adapter, FileRef file, Class<T> type) throws IOException {
            String raw = adapter.readText(file);
            try {
                T value = mapper.readValue(raw, type);
                return Optional.ofNullable(value);
            } catch (IOException e) {
                log.warn("Manifest {} ilegível, usando padrão em memória: {}", file.name(), e.getMessage());
                return Optional.empty();
            }
        }

        private BookManifest defaultBookManifest(FolderBackend backend, FolderRef root, Book book) {
            BookManifest m = new BookManifest();
            m.bookId = book.id;
            m.title = book.title;
            m.createdAt = clock.millis();
            m.backend = backend.wireName();
            m.rootFolderId = root.id();
            m.folders.put(META_FOLDER, META_FOLDER);
            m.folders.put(TEXT_FOLDER, TEXT_FOLDER);
            m.folders.put(AUDIO_FOLDER, AUDIO_FOLDER);
            m.folders.put(TRASH_FOLDER, TRASH_FOLDER);
            return m;
        }

        private InventoryManifest defaultInventory(Book book) throws IOException {
            Map<String, InventoryChapter> byId = new LinkedHashMap<>();
            Integer after = null;
            while (true) {
                List<Chapter> page = library.listChaptersPage(book.id, after, CHAPTER_PAGE_SIZE);
                for (Chapter c : page) {
                    byId.putIfAbsent(c.id, toInventoryChapter(c));
                }
                if (page.size() < CHAPTER_PAGE_SIZE) break;
                after = page.get(page.size() - 1).index;
            }
            InventoryManifest inv = new InventoryManifest();
            inv.bookId = book.id;
            inv.chapters = new ArrayList<>(byId.values());
            inv.expectedTotal = inv.chapters.size();
            return inv;
        }

        static InventoryChapter toInventoryChapter(Chapter c) {
            InventoryChapter ic = new InventoryChapter();
            ic.chapterId = c.id;
            ic.idx = c.index;
            ic.title = c.title;
            ic.textName = ChapterFileNames.buildTextName(c.index, c.title);
            ic.audioName = ChapterFileNames.buildAudioName(c.index, c.title);
            ic.volumeName = c.volumeName;
            ic.volumeLocalChapter = c.volumeLocalChapter;
            boolean legacyText = c.textFileName != null && !c.textFileName.equals(ic.textName);
            boolean legacyAudio = c.audioFileName != null && !c.audioFileName.equals(ic.audioName);
            if (legacyText || legacyAudio) {
                LegacyRef legacy = new LegacyRef();
                legacy.legacyIdx = c.index;
                legacy.legacyTextName = legacyText ? c.textFileName : null;
                legacy.legacyAudioName = legacyAudio ? c.audioFileName : null;
                ic.legacy = legacy;
            }
            return ic;
        }
    }
}
