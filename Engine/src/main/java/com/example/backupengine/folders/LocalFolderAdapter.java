package com.example.backupengine.folders;

import com.example.backupengine.folders.FolderManifests.FileRef;
import com.example.backupengine.folders.FolderManifests.FolderAdapter;
import com.example.backupengine.folders.FolderManifests.FolderBackend;
import com.example.backupengine.folders.FolderManifests.FolderRef;
import com.example.backupengine.storage.Storage;
import com.example.backupengine.storage.Storage.DirEntry;
import com.example.backupengine.storage.Storage.FileStat;
import com.example.backupengine.storage.Storage.NativeFileSystem;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link FolderAdapter} sobre o filesystem nativo. Ids são caminhos relativos à base.
 * Nomes são únicos por diretório, então não há desempate.
 */
public final class LocalFolderAdapter implements FolderAdapter {

    private final NativeFileSystem fileSystem;

    public LocalFolderAdapter(NativeFileSystem fileSystem) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
    }

    @Override
    public FolderBackend backend() {
        return FolderBackend.LOCAL;
    }

    public FolderRef root(String path) {
        return new FolderRef(FolderBackend.LOCAL, Storage.trimSlashes(path), path);
    }

    @Override
    public FolderRef ensureFolder(FolderRef parent, String name) throws IOException {
        String path = Storage.join(parent.id(), name);
        fileSystem.mkdirs(path);
        return new FolderRef(FolderBackend.LOCAL, path, name);
    }

    @Override
    public List<FileRef> list(FolderRef folder) throws IOException {
        List<FileRef> out = new ArrayList<>();
        for (DirEntry e : fileSystem.list(folder.id())) {
            out.add(new FileRef(FolderBackend.LOCAL, Storage.join(folder.id(), e.name()), e.name(),
                    e.directory(), e.modifiedAt()));
        }
        return out;
    }

    @Override
    public Optional<FileRef> findByName(FolderRef folder, String name) throws IOException {
        String path = Storage.join(folder.id(), name);
        Optional<FileStat> stat = fileSystem.stat(path);
        return stat.map(s -> new FileRef(FolderBackend.LOCAL, path, name, s.directory(), s.modifiedAt()));
    }

    @Override
    public String readText(FileRef file) throws IOException {
        return new String(fileSystem.read(file.id()), StandardCharsets.UTF_8);
    }

    @Override
    public FileRef writeText(FolderRef folder, String name, String content, FileRef existing) throws IOException {
        String path = existing != null ? existing.id() : Storage.join(folder.id(), name);
        fileSystem.write(path, content.getBytes(StandardCharsets.UTF_8));
        return new FileRef(FolderBackend.LOCAL, path, name, false, null);
    }
}
