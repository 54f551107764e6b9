package com.example.backupengine.archive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Escritor sequencial do ZIP de backup (DEFLATE nível 6).
 * Nomes repetidos são recusados para manter o layout fixo do arquivo.
 */
public final class ArchiveWriter implements Closeable {

    public static final int COMPRESSION_LEVEL = 6;

    private final ZipOutputStream zip;
    private final ObjectMapper mapper;
    private final Set<String> written = new HashSet<>();
    private long entries;

    public ArchiveWriter(Path target, ObjectMapper mapper) throws IOException {
        this(new BufferedOutputStream(Files.newOutputStream(target)), mapper);
    }

    public ArchiveWriter(OutputStream out, ObjectMapper mapper) {
        this.zip = new ZipOutputStream(Objects.requireNonNull(out, "out"));
        this.zip.setMethod(ZipOutputStream.DEFLATED);
        this.zip.setLevel(COMPRESSION_LEVEL);
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public void putJson(String name, Object value) throws IOException {
        byte[] bytes = value instanceof JsonNode
                ? mapper.writeValueAsBytes(value)
                : mapper.writeValueAsBytes(mapper.valueToTree(value));
        putBytes(name, bytes);
    }

    public void putBytes(String name, byte[] content) throws IOException {
        Objects.requireNonNull(content, "content");
        if (!written.add(name)) {
            throw new IOException("Entrada duplicada no backup: " + name);
        }
        ZipEntry entry = new ZipEntry(name);
        zip.putNextEntry(entry);
        zip.write(content);
        zip.closeEntry();
        entries++;
    }

    public long entries() {
        return entries;
    }

    @Override
    public void close() throws IOException {
        zip.finish();
        zip.close();
    }
}
