package com.example.backupengine.archive;

import com.example.backupengine.archive.Archive.ArchiveBundle;
import com.example.backupengine.archive.Archive.ArchiveMeta;
import com.example.backupengine.archive.Archive.EntryResult;
import com.example.backupengine.archive.Archive.FileManifestEntry;
import com.example.backupengine.archive.Archive.StorageDriverState;
import com.example.backupengine.library.Library.FullSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Leitura do ZIP de backup com desserialização explícita por entrada.
 * <p>
 * Cada entrada vira um {@link EntryResult}: presente, ausente ou inválida. Apenas meta.json e
 * state/fullSnapshot.json são obrigatórias; as demais ausentes ou inválidas viram vazias.
 */
public final class ArchiveReader implements Closeable {

    private static final TypeReference<List<FileManifestEntry>> MANIFEST_TYPE = new TypeReference<>() {};

    private final ZipFile zip;
    private final ObjectMapper mapper;

    private ArchiveReader(ZipFile zip, ObjectMapper mapper) {
        this.zip = zip;
        this.mapper = mapper;
    }

    /**
     * @throws ArchiveFormatException se o arquivo não for um ZIP legível
     */
    public static ArchiveReader open(Path archive, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(archive, "archive");
        try {
            return new ArchiveReader(new ZipFile(archive.toFile()), Objects.requireNonNull(mapper, "mapper"));
        } catch (ZipException e) {
            throw new ArchiveFormatException(archive.getFileName().toString(), "Invalid backup ZIP: " + e.getMessage(), e);
        }
    }

    public boolean has(String name) {
        return zip.getEntry(name) != null;
    }

    public InputStream openEntry(String name) throws IOException {
        ZipEntry entry = zip.getEntry(name);
        if (entry == null) {
            throw new IOException("Entrada inexistente no backup: " + name);
        }
        return zip.getInputStream(entry);
    }

    /** Entradas de arquivo (files/...) na ordem do ZIP, sem diretórios. */
    public List<String> fileEntries() {
        List<String> names = new ArrayList<>();
        Iterator<? extends ZipEntry> it = zip.entries().asIterator();
        while (it.hasNext()) {
            ZipEntry e = it.next();
            if (!e.isDirectory() && e.getName().startsWith(Archive.FILES_PREFIX)) {
                names.add(e.getName());
            }
        }
        return names;
    }

    public EntryResult<JsonNode> readJson(String name) throws IOException {
        ZipEntry entry = zip.getEntry(name);
        if (entry == null) {
            return EntryResult.absent(name);
        }
        try (InputStream in = zip.getInputStream(entry)) {
            JsonNode node = mapper.readTree(in);
            if (node == null || node.isMissingNode()) {
                return EntryResult.invalid(name, "vazio");
            }
            return EntryResult.present(name, node);
        } catch (JsonProcessingException e) {
            return EntryResult.invalid(name, String.valueOf(e.getOriginalMessage()));
        }
    }

    public <T> EntryResult<T> readEntry(String name, TypeReference<T> type) throws IOException {
        EntryResult<JsonNode> raw = readJson(name);
        if (!raw.isPresent()) {
            return raw.status() == EntryResult.Status.INVALID
                    ? EntryResult.invalid(name, raw.error().orElse("inválida"))
                    : EntryResult.absent(name);
        }
        try {
            T value = mapper.convertValue(raw.value().get(), type);
            return value == null ? EntryResult.invalid(name, "null") : EntryResult.present(name, value);
        } catch (IllegalArgumentException e) {
            return EntryResult.invalid(name, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Interpreta o arquivo inteiro. Problemas em entradas opcionais são anexados a {@code warnings}.
     *
     * @throws ArchiveFormatException se meta.json ou o snapshot estiverem ausentes ou inválidos
     */
    public ArchiveBundle readBundle(List<String> warnings) throws IOException {
        Objects.requireNonNull(warnings, "warnings");

        EntryResult<JsonNode> metaEntry = readJson(Archive.META_ENTRY);
        if (metaEntry.status() == EntryResult.Status.ABSENT) {
            throw new ArchiveFormatException(Archive.META_ENTRY, "Invalid backup ZIP: missing meta.json");
        }
        if (!metaEntry.isPresent()) {
            throw new ArchiveFormatException(Archive.META_ENTRY, "Invalid backup metadata.");
        }
        ArchiveMeta meta = ArchiveMeta.fromJson(metaEntry.value().get());

        EntryResult<FullSnapshot> snapshot = readEntry(Archive.SNAPSHOT_ENTRY, new TypeReference<FullSnapshot>() {});
        if (!snapshot.isPresent()) {
            throw new ArchiveFormatException(Archive.SNAPSHOT_ENTRY, "Invalid backup ZIP: missing state/fullSnapshot.json");
        }

        Map<String, String> prefs = Collections.emptyMap();
        EntryResult<JsonNode> prefsEntry = readJson(Archive.PREFS_ENTRY);
        if (prefsEntry.isPresent() && prefsEntry.value().get().isObject()) {
            prefs = toStringMap(prefsEntry.value().get());
        } else if (prefsEntry.status() != EntryResult.Status.ABSENT) {
            warnings.add("invalid-entry:" + Archive.PREFS_ENTRY);
        }

        String exportName = has(Archive.SQLITE_ENTRY) ? Archive.SQLITE_ENTRY : Archive.DB_EXPORT_ENTRY;
        EntryResult<JsonNode> export = readJson(exportName);
        if (export.status() == EntryResult.Status.INVALID) {
            warnings.add("invalid-entry:" + exportName);
        }

        EntryResult<StorageDriverState> driver = readEntry(Archive.DRIVER_STATE_ENTRY, new TypeReference<StorageDriverState>() {});
        if (driver.status() == EntryResult.Status.INVALID) {
            warnings.add("invalid-entry:" + Archive.DRIVER_STATE_ENTRY);
        }

        EntryResult<List<FileManifestEntry>> manifest = readEntry(Archive.FILES_MANIFEST_ENTRY, MANIFEST_TYPE);
        if (manifest.status() == EntryResult.Status.INVALID) {
            warnings.add("invalid-entry:" + Archive.FILES_MANIFEST_ENTRY);
        }

        return new ArchiveBundle(meta,
                prefs,
                export.value().orElse(null),
                snapshot.value().get(),
                driver.value().orElse(null),
                manifest.value().orElse(List.of()),
                fileEntries());
    }

    private static Map<String, String> toStringMap(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> {
            JsonNode v = e.getValue();
            if (v == null || v.isNull()) return;
            out.put(e.getKey(), v.isTextual() ? v.textValue() : v.toString());
        });
        return out;
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }
}
