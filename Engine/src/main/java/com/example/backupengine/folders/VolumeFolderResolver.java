package com.example.backupengine.folders;

import com.example.backupengine.folders.FolderManifests.FileRef;
import com.example.backupengine.folders.FolderManifests.FolderAdapter;
import com.example.backupengine.folders.FolderManifests.FolderRef;
import com.example.backupengine.library.Library.Chapter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolve a subpasta de volume de um capítulo dentro da pasta do livro.
 * <p>
 * Ids encontrados ficam em cache por backend e raiz até {@link #clearCache()} ou
 * {@link #clearCache(String)} serem chamados.
 */
public final class VolumeFolderResolver {

    private static final Logger log = LoggerFactory.getLogger(VolumeFolderResolver.class);

    /** Pastas de sistema que nunca são volumes. */
    public static final Set<String> SYSTEM_FOLDER_NAMES = Set.of("meta", "attachments", "trash", "text", "audio");

    private final FolderAdapter adapter;
    private final Map<String, FolderRef> cache = new ConcurrentHashMap<>();

    public VolumeFolderResolver(FolderAdapter adapter) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
    }

    /** Nome do volume aparado, ou vazio quando o capítulo não tem volume. */
    public static Optional<String> volumeName(Chapter chapter) {
        if (chapter == null || chapter.volumeName == null) return Optional.empty();
        String trimmed = chapter.volumeName.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    /** Pasta onde os arquivos do capítulo ficam, criando a do volume se preciso. */
    public FolderRef ensureStorageFolder(FolderRef bookRoot, Chapter chapter) throws IOException {
        Optional<String> volume = volumeName(chapter);
        if (volume.isEmpty()) return bookRoot;

        String key = cacheKey(bookRoot, volume.get());
        FolderRef cached = cache.get(key);
        if (cached != null) return cached;

        FolderRef created = adapter.ensureFolder(bookRoot, volume.get());
        cache.put(key, created);
        return created;
    }

    /** Como {@link #ensureStorageFolder}, mas sem criar: vazio se a pasta do volume não existir. */
    public Optional<FolderRef> findStorageFolder(FolderRef bookRoot, Chapter chapter) throws IOException {
        Optional<String> volume = volumeName(chapter);
        if (volume.isEmpty()) return Optional.of(bookRoot);

        String key = cacheKey(bookRoot, volume.get());
        FolderRef cached = cache.get(key);
        if (cached != null) return Optional.of(cached);

        String wanted = volume.get().toLowerCase(Locale.ROOT);
        for (FileRef f : adapter.list(bookRoot)) {
            if (f.folder() && f.name().trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                FolderRef ref = new FolderRef(f.backend(), f.id(), f.name());
                cache.put(key, ref);
                return Optional.of(ref);
            }
        }
        return Optional.empty();
    }

    /** Subpastas da pasta do livro que não são de sistema. */
    public List<FolderRef> listVolumeFolders(FolderRef bookRoot) throws IOException {
        List<FolderRef> out = new ArrayList<>();
        for (FileRef f : adapter.list(bookRoot)) {
            if (!f.folder()) continue;
            String name = f.name().trim();
            if (name.isEmpty() || SYSTEM_FOLDER_NAMES.contains(name.toLowerCase(Locale.ROOT))) continue;
            out.add(new FolderRef(f.backend(), f.id(), name));
        }
        return out;
    }

    public void clearCache() {
        cache.clear();
    }

    /** Invalida só as entradas de uma raiz (pasta do livro). */
    public void clearCache(String bookRootId) {
        if (bookRootId == null) {
            clearCache();
            return;
        }
        String infix = "::" + bookRootId + "::";
        int before = cache.size();
        cache.keySet().removeIf(k -> k.contains(infix));
        log.debug("Cache de volumes limpo para {} ({} entradas)", bookRootId, before - cache.size());
    }

    int cacheSize() {
        return cache.size();
    }

    private String cacheKey(FolderRef root, String volume) {
        return adapter.backend().wireName() + "::" + root.id() + "::" + volume.toLowerCase(Locale.ROOT);
    }
}
