package com.example.backupengine.testing;

import com.example.backupengine.storage.Storage.DirEntry;
import com.example.backupengine.storage.Storage.FileStat;
import com.example.backupengine.storage.Storage.NativeFileSystem;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Delegação que falha leituras, escritas ou listagens de caminhos escolhidos. */
public final class FailingFileSystem implements NativeFileSystem {

    private final NativeFileSystem delegate;
    private final Set<String> failingReads = new HashSet<>();
    private final Set<String> failingWrites = new HashSet<>();
    private final Map<String, RuntimeException> failingLists = new HashMap<>();

    public FailingFileSystem(NativeFileSystem delegate) {
        this.delegate = delegate;
    }

    public FailingFileSystem failRead(String path) {
        failingReads.add(path);
        return this;
    }

    public FailingFileSystem failWrite(String path) {
        failingWrites.add(path);
        return this;
    }

    public FailingFileSystem failList(String dir, RuntimeException failure) {
        failingLists.put(dir, failure);
        return this;
    }

    @Override
    public List<DirEntry> list(String dir) throws IOException {
        RuntimeException failure = failingLists.get(dir);
        if (failure != null) {
            throw failure;
        }
        return delegate.list(dir);
    }

    @Override
    public Optional<FileStat> stat(String path) throws IOException {
        return delegate.stat(path);
    }

    @Override
    public byte[] read(String path) throws IOException {
        if (failingReads.contains(path)) {
            throw new IOException("permission denied");
        }
        return delegate.read(path);
    }

    @Override
    public void write(String path, InputStream content) throws IOException {
        if (failingWrites.contains(path)) {
            throw new IOException("disk full");
        }
        delegate.write(path, content);
    }

    @Override
    public void mkdirs(String dir) throws IOException {
        delegate.mkdirs(dir);
    }

    @Override
    public void delete(String path) throws IOException {
        delegate.delete(path);
    }
}
