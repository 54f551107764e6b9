package com.example.backupengine.drive;

import com.example.backupengine.folders.FolderManifests;
import com.example.backupengine.folders.FolderManifests.FileRef;
import com.example.backupengine.folders.FolderManifests.FolderAdapter;
import com.example.backupengine.folders.FolderManifests.FolderBackend;
import com.example.backupengine.folders.FolderManifests.FolderRef;
import com.example.backupengine.storage.Storage.RemoteFile;
import com.example.backupengine.storage.Storage.RemoteStorage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FolderAdapter} sobre o storage remoto. O Drive aceita nomes repetidos na mesma pasta;
 * nesse caso vale o item com modifiedTime mais recente.
 */
public final class DriveFolderAdapter implements FolderAdapter {

    private static final Logger log = LoggerFactory.getLogger(DriveFolderAdapter.class);

    /** Subpasta da raiz configurada que guarda os backups e o ponteiro. */
    public static final String SAVES_FOLDER = "saves";

    private static final String JSON_MIME = "application/json";

    private final RemoteStorage remote;

    public DriveFolderAdapter(RemoteStorage remote) {
        this.remote = Objects.requireNonNull(remote, "remote");
    }

    @Override
    public FolderBackend backend() {
        return FolderBackend.DRIVE;
    }

    public static FolderRef root(String folderId) {
        return new FolderRef(FolderBackend.DRIVE, folderId, null);
    }

    /** Garante a estrutura da raiz e devolve a pasta de saves. */
    public FolderRef ensureRootStructure(String rootFolderId) throws IOException {
        FolderRef saves = ensureFolder(root(rootFolderId), SAVES_FOLDER);
        log.debug("Pasta de saves do Drive: {}", saves.id());
        return saves;
    }

    @Override
    public FolderRef ensureFolder(FolderRef parent, String name) throws IOException {
        Optional<FileRef> existing = FolderManifests.newestNamed(list(parent), name, true);
        if (existing.isPresent()) {
            return new FolderRef(FolderBackend.DRIVE, existing.get().id(), name);
        }
        RemoteFile created = remote.createFolder(parent.id(), name);
        log.info("Pasta criada no Drive: {} ({})", name, created.id());
        return new FolderRef(FolderBackend.DRIVE, created.id(), name);
    }

    @Override
    public List<FileRef> list(FolderRef folder) throws IOException {
        List<FileRef> out = new ArrayList<>();
        for (RemoteFile f : remote.listFiles(folder.id())) {
            out.add(toRef(f));
        }
        return out;
    }

    @Override
    public Optional<FileRef> findByName(FolderRef folder, String name) throws IOException {
        return FolderManifests.newestNamed(list(folder), name, false);
    }

    @Override
    public String readText(FileRef file) throws IOException {
        return new String(remote.fetch(file.id()), StandardCharsets.UTF_8);
    }

    @Override
    public FileRef writeText(FolderRef folder, String name, String content, FileRef existing) throws IOException {
        RemoteFile f = remote.upload(folder.id(), name, JSON_MIME, content.getBytes(StandardCharsets.UTF_8),
                existing == null ? null : existing.id());
        return toRef(f);
    }

    private static FileRef toRef(RemoteFile f) {
        return new FileRef(FolderBackend.DRIVE, f.id(), f.name(), f.isFolder(), f.modifiedTime().orElse(null));
    }
}
