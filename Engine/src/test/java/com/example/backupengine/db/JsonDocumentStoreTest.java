package com.example.backupengine.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupengine.archive.Archive;
import com.example.backupengine.archive.Archive.ChapterAudioPath;
import com.example.backupengine.db.Database.JsonDocumentStore;
import com.example.backupengine.library.Library.Attachment;
import com.example.backupengine.library.Library.Book;
import com.example.backupengine.library.Library.Chapter;
import com.example.backupengine.library.Library.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonDocumentStoreTest {

    private final ObjectMapper mapper = Archive.newMapper();

    @Test
    void persistsAcrossInstances(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("library.json");
        JsonDocumentStore store = new JsonDocumentStore(file, mapper);
        store.upsertBook(new Book("b1", "Livro"));
        store.bulkUpsertChapters("b1", List.of(new Chapter("c1", "b1", 1, "Um")));
        store.createJob(new JobRecord("j1", "tts", "queued"));

        JsonDocumentStore reopened = new JsonDocumentStore(file, mapper);

        assertEquals("Livro", reopened.listBooks().get(0).title);
        assertEquals(1, reopened.listChapters("b1").size());
        assertEquals("j1", reopened.listJobs().get(0).id);
    }

    @Test
    void chapterPagesAreOrderedByIndex() throws Exception {
        JsonDocumentStore store = new JsonDocumentStore(mapper);
        store.bulkUpsertChapters("b1", List.of(
                new Chapter("c3", "b1", 3, "Tres"),
                new Chapter("c1", "b1", 1, "Um"),
                new Chapter("c2", "b1", 2, "Dois"),
                new Chapter("x1", "b2", 1, "Outro livro")));

        List<String> first = store.listChaptersPage("b1", null, 2).stream().map(c -> c.id).collect(Collectors.toList());
        List<String> rest = store.listChaptersPage("b1", 2, 2).stream().map(c -> c.id).collect(Collectors.toList());

        assertEquals(List.of("c1", "c2"), first);
        assertEquals(List.of("c3"), rest);
    }

    @Test
    void upsertsReplaceById() throws Exception {
        JsonDocumentStore store = new JsonDocumentStore(mapper);
        store.upsertBook(new Book("b1", "Antigo"));
        store.upsertBook(new Book("b1", "Novo"));
        store.setChapterAudioPath(new ChapterAudioPath("c1", "talevox/audio/a.mp3", 10, null));
        store.setChapterAudioPath(new ChapterAudioPath("c1", "talevox/audio/b.mp3", 20, null));

        assertEquals(1, store.listBooks().size());
        assertEquals("Novo", store.listBooks().get(0).title);
        assertEquals("talevox/audio/b.mp3", store.listChapterAudioPaths().get(0).localPath);
    }

    @Test
    void storedRecordsAreIsolatedFromCallers() throws Exception {
        JsonDocumentStore store = new JsonDocumentStore(mapper);
        Attachment attachment = new Attachment("a1", "b1", "capa.jpg");
        JobRecord job = new JobRecord("j1", "tts", "queued");
        ChapterAudioPath audio = new ChapterAudioPath("c1", "talevox/audio/c1.mp3", 10L, 1L);
        store.upsertAttachments("b1", List.of(attachment));
        store.createJob(job);
        store.setChapterAudioPath(audio);

        attachment.filename = "trocado.jpg";
        job.status = "done";
        audio.localPath = "outro.mp3";
        store.listAttachments().get(0).mimeType = "image/png";
        store.listJobs().get(0).error = "boom";
        store.listChapterAudioPaths().get(0).sizeBytes = 99L;

        Attachment storedAttachment = store.listAttachments().get(0);
        assertEquals("capa.jpg", storedAttachment.filename);
        assertNull(storedAttachment.mimeType);
        JobRecord storedJob = store.listJobs().get(0);
        assertEquals("queued", storedJob.status);
        assertNull(storedJob.error);
        ChapterAudioPath storedAudio = store.listChapterAudioPaths().get(0);
        assertEquals("talevox/audio/c1.mp3", storedAudio.localPath);
        assertEquals(10L, storedAudio.sizeBytes);
    }

    @Test
    void queuedUploadsAreIdempotentById() throws Exception {
        JsonDocumentStore store = new JsonDocumentStore(mapper);
        ObjectNode upload = mapper.createObjectNode().put("id", "u1").put("status", "queued");
        store.enqueueUpload(upload);
        store.enqueueUpload(upload.deepCopy().put("status", "retry"));

        assertEquals(1, store.listQueuedUploads().size());
        assertEquals("retry", store.listQueuedUploads().get(0).get("status").asText());
    }

    @Test
    void exportImportReplacesDocument() throws Exception {
        JsonDocumentStore source = new JsonDocumentStore(mapper);
        source.upsertBook(new Book("b1", "Livro"));
        JsonNode export = source.exportJson();

        JsonDocumentStore target = new JsonDocumentStore(mapper);
        target.upsertBook(new Book("other", "Some"));
        assertTrue(target.isJsonValid(export));
        target.importJson(export);

        assertEquals(List.of("b1"), target.listBooks().stream().map(b -> b.id).collect(Collectors.toList()));
    }

    @Test
    void structuralValidation() {
        JsonDocumentStore store = new JsonDocumentStore(mapper);

        assertFalse(store.isJsonValid(null));
        assertFalse(store.isJsonValid(mapper.createObjectNode().put("mode", "web-fallback")));
        assertFalse(store.isJsonValid(mapper.createObjectNode()
                .put("format", JsonDocumentStore.FORMAT).put("version", JsonDocumentStore.VERSION + 1)));
        ObjectNode noChapters = mapper.createObjectNode().put("format", JsonDocumentStore.FORMAT).put("version", 1);
        noChapters.putArray("books");
        assertFalse(store.isJsonValid(noChapters));
        assertThrows(IOException.class, () -> store.importJson(noChapters));
    }
}
