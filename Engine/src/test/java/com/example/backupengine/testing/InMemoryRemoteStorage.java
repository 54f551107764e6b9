package com.example.backupengine.testing;

import com.example.backupengine.storage.Storage;
import com.example.backupengine.storage.Storage.RemoteFile;
import com.example.backupengine.storage.Storage.RemoteStorage;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/** Pasta remota em memória com relógio próprio para modifiedTime. */
public final class InMemoryRemoteStorage implements RemoteStorage {

    private static final class Node {
        final String parentId;
        RemoteFile file;
        byte[] content;

        Node(String parentId, RemoteFile file, byte[] content) {
            this.parentId = parentId;
            this.file = file;
            this.content = content;
        }
    }

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Set<String> failingDeletes = new HashSet<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final AtomicInteger listCalls = new AtomicInteger();
    private IOException listingFailure;
    private long clock = 1_700_000_000_000L;

    public RemoteFile addFile(String parentId, String name, byte[] content) {
        return put(parentId, newId(), name, "application/octet-stream", content, Instant.ofEpochMilli(clock += 1000));
    }

    public RemoteFile addFile(String parentId, String id, String name, Instant modifiedTime) {
        return put(parentId, id, name, "application/octet-stream", new byte[0], modifiedTime);
    }

    public RemoteFile addFolder(String parentId, String id, String name) {
        return put(parentId, id, name, Storage.FOLDER_MIME_TYPE, null, Instant.ofEpochMilli(clock += 1000));
    }

    public void failListingWith(IOException failure) {
        this.listingFailure = failure;
    }

    public void failDeleteOf(String fileId) {
        failingDeletes.add(fileId);
    }

    public int listCalls() {
        return listCalls.get();
    }

    public boolean exists(String fileId) {
        return nodes.containsKey(fileId);
    }

    public List<RemoteFile> children(String parentId) {
        List<RemoteFile> out = new ArrayList<>();
        for (Node n : nodes.values()) {
            if (parentId.equals(n.parentId)) out.add(n.file);
        }
        return out;
    }

    public byte[] content(String fileId) {
        return nodes.get(fileId).content;
    }

    @Override
    public RemoteFile createFolder(String parentId, String name) {
        return addFolder(parentId, newId(), name);
    }

    @Override
    public List<RemoteFile> listFiles(String parentId) throws IOException {
        listCalls.incrementAndGet();
        if (listingFailure != null) {
            throw listingFailure;
        }
        return children(parentId);
    }

    @Override
    public RemoteFile upload(String parentId, String name, String mimeType, byte[] content, String existingFileId)
            throws IOException {
        Instant now = Instant.ofEpochMilli(clock += 1000);
        if (existingFileId != null) {
            Node n = nodes.get(existingFileId);
            if (n == null) throw new IOException("arquivo inexistente: " + existingFileId);
            n.file = new RemoteFile(existingFileId, name, mimeType, now, content.length);
            n.content = content.clone();
            return n.file;
        }
        return put(parentId, newId(), name, mimeType, content.clone(), now);
    }

    @Override
    public void delete(String fileId) throws IOException {
        if (failingDeletes.contains(fileId)) {
            throw new IOException("delete recusado: " + fileId);
        }
        nodes.remove(fileId);
    }

    @Override
    public byte[] fetch(String fileId) throws IOException {
        Node n = nodes.get(fileId);
        if (n == null || n.content == null) throw new IOException("arquivo inexistente: " + fileId);
        return n.content.clone();
    }

    private RemoteFile put(String parentId, String id, String name, String mime, byte[] content, Instant modified) {
        RemoteFile f = new RemoteFile(id, name, mime, modified, content == null ? 0 : content.length);
        nodes.put(id, new Node(parentId, f, content));
        return f;
    }

    private String newId() {
        return "F" + ids.incrementAndGet();
    }
}
