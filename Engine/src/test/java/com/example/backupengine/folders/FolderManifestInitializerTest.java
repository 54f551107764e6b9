package com.example.backupengine.folders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupengine.archive.Archive;
import com.example.backupengine.db.Database.JsonDocumentStore;
import com.example.backupengine.drive.DriveFolderAdapter;
import com.example.backupengine.folders.FolderManifests.BookFolderManifests;
import com.example.backupengine.folders.FolderManifests.FolderManifestInitializer;
import com.example.backupengine.folders.FolderManifests.FolderRef;
import com.example.backupengine.folders.FolderManifests.InventoryChapter;
import com.example.backupengine.folders.FolderManifests.InventoryManifest;
import com.example.backupengine.library.Library.Book;
import com.example.backupengine.library.Library.Chapter;
import com.example.backupengine.storage.Storage.LocalFileSystem;
import com.example.backupengine.storage.Storage.RemoteFile;
import com.example.backupengine.testing.InMemoryRemoteStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FolderManifestInitializerTest {

    private final ObjectMapper mapper = Archive.newMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC);
    private JsonDocumentStore db;
    private InMemoryRemoteStorage remote;
    private DriveFolderAdapter adapter;
    private FolderManifestInitializer initializer;
    private Book book;

    @BeforeEach
    void setUp() throws Exception {
        db = new JsonDocumentStore(mapper);
        book = new Book("b1", "Livro");
        db.upsertBook(book);
        db.bulkUpsertChapters("b1", List.of(new Chapter("c1", "b1", 1, "Um"), new Chapter("c2", "b1", 2, "Dois")));
        remote = new InMemoryRemoteStorage();
        adapter = new DriveFolderAdapter(remote);
        initializer = new FolderManifestInitializer(db, mapper, clock);
    }

    private RemoteFile child(String parentId, String name) {
        return remote.children(parentId).stream().filter(f -> f.name().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void createsLayoutAndManifestsOnFirstRun() throws Exception {
        BookFolderManifests result = initializer.ensure(adapter, DriveFolderAdapter.root("BOOK"), book);

        assertTrue(result.bookCreated());
        assertTrue(result.inventoryCreated());
        assertEquals(4, remote.children("BOOK").size());
        assertEquals("3.0", result.book().schemaVersion);
        assertEquals("drive", result.book().backend);
        assertEquals("BOOK", result.book().rootFolderId);
        assertEquals(clock.millis(), result.book().createdAt);
        assertEquals(2, result.inventory().expectedTotal);
        assertEquals("001_Um.txt", result.inventory().chapters.get(0).textName);
        assertEquals("002_Dois.mp3", result.inventory().chapters.get(1).audioName);

        String metaId = result.metaFolder().id();
        InventoryManifest stored = mapper.readValue(
                new String(remote.content(child(metaId, "inventory.json").id()), StandardCharsets.UTF_8),
                InventoryManifest.class);
        assertEquals("b1", stored.bookId);
        assertEquals(2, stored.chapters.size());
    }

    @Test
    void secondRunReusesEverything() throws Exception {
        initializer.ensure(adapter, DriveFolderAdapter.root("BOOK"), book);
        db.bulkUpsertChapters("b1", List.of(new Chapter("c3", "b1", 3, "Tres")));

        BookFolderManifests again = initializer.ensure(adapter, DriveFolderAdapter.root("BOOK"), book);

        assertFalse(again.bookCreated());
        assertFalse(again.inventoryCreated());
        assertEquals(4, remote.children("BOOK").size());
        assertEquals(2, remote.children(again.metaFolder().id()).size());
        assertEquals(2, again.inventory().chapters.size());
    }

    @Test
    void unreadableInventoryIsReplacedInMemoryOnly() throws Exception {
        BookFolderManifests first = initializer.ensure(adapter, DriveFolderAdapter.root("BOOK"), book);
        String metaId = first.metaFolder().id();
        RemoteFile inventory = child(metaId, "inventory.json");
        remote.upload(metaId, "inventory.json", "application/json", "{".getBytes(StandardCharsets.UTF_8), inventory.id());

        BookFolderManifests again = initializer.ensure(adapter, DriveFolderAdapter.root("BOOK"), book);

        assertFalse(again.inventoryCreated());
        assertEquals(2, again.inventory().chapters.size());
        assertEquals("{", new String(remote.content(inventory.id()), StandardCharsets.UTF_8));
    }

    @Test
    void inventoryPagesThroughLargeBooks() throws Exception {
        List<Chapter> many = new ArrayList<>();
        for (int i = 1; i <= FolderManifests.CHAPTER_PAGE_SIZE * 2 + 7; i++) {
            many.add(new Chapter("x" + i, "b2", i, "Capitulo " + i));
        }
        Book big = new Book("b2", "Grande");
        db.upsertBook(big);
        db.bulkUpsertChapters("b2", many);

        BookFolderManifests result = initializer.ensure(adapter, DriveFolderAdapter.root("BIG"), big);

        assertEquals(many.size(), result.inventory().chapters.size());
        assertEquals(many.size(), result.inventory().expectedTotal);
        assertEquals("x" + many.size(), result.inventory().chapters.get(many.size() - 1).chapterId);
    }

    @Test
    void legacyNamesAreRecorded() {
        Chapter c = new Chapter("c1", "b1", 1, "Um");
        c.textFileName = "Chapter 1.txt";
        c.audioFileName = "001_Um.mp3";

        InventoryChapter entry = FolderManifestInitializer.toInventoryChapter(c);

        assertEquals(1, entry.legacy.legacyIdx);
        assertEquals("Chapter 1.txt", entry.legacy.legacyTextName);
        assertNull(entry.legacy.legacyAudioName);
        assertNull(FolderManifestInitializer.toInventoryChapter(new Chapter("c2", "b1", 2, "Dois")).legacy);
    }

    @Test
    void putChapterKeepsEntriesUnique() {
        InventoryManifest inv = new InventoryManifest();
        InventoryChapter a = new InventoryChapter();
        a.chapterId = "c1";
        a.title = "antigo";
        InventoryChapter b = new InventoryChapter();
        b.chapterId = "c1";
        b.title = "novo";

        inv.putChapter(a);
        inv.putChapter(b);

        assertEquals(1, inv.chapters.size());
        assertEquals("novo", inv.chapters.get(0).title);
        assertEquals(1, inv.expectedTotal);
    }

    @Test
    void worksOverLocalFolders(@TempDir Path dir) throws Exception {
        LocalFileSystem fs = new LocalFileSystem(dir);
        LocalFolderAdapter local = new LocalFolderAdapter(fs);
        FolderRef root = local.root("talevox/books/b1");
        fs.mkdirs(root.id());

        BookFolderManifests result = initializer.ensure(local, root, book);
        BookFolderManifests again = initializer.ensure(local, root, book);

        assertTrue(result.bookCreated());
        assertFalse(again.bookCreated());
        assertEquals("local", again.book().backend);
        assertTrue(Files.exists(dir.resolve("talevox/books/b1/meta/book.json")));
        assertTrue(Files.isDirectory(dir.resolve("talevox/books/b1/trash")));
    }
}
