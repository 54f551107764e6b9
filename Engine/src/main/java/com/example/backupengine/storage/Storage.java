package com.example.backupengine.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centraliza as abstrações dos dois storages que o motor toca: o filesystem nativo do dispositivo
 * e o serviço remoto de pastas.
 */
public final class Storage {

    private Storage() {}

    /** Mime type usado pelo Drive para pastas. */
    public static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";

    // ---- Filesystem nativo -----------------------------------------------

    /**
     * Primitivas do filesystem nativo. Caminhos são relativos à base de dados do app, com "/".
     */
    public interface NativeFileSystem {

        /** @throws NoSuchFileException se o diretório não existir */
        List<DirEntry> list(String dir) throws IOException;

        Optional<FileStat> stat(String path) throws IOException;

        byte[] read(String path) throws IOException;

        /** Grava (substituindo) o conteúdo; o diretório pai precisa existir. */
        void write(String path, InputStream content) throws IOException;

        void mkdirs(String dir) throws IOException;

        void delete(String path) throws IOException;

        default void write(String path, byte[] content) throws IOException {
            write(path, new java.io.ByteArrayInputStream(content));
        }
    }

    public static final class DirEntry {
        private final String name;
        private final boolean directory;
        private final long size;
        private final Instant modifiedAt;

        public DirEntry(String name, boolean directory, long size, Instant modifiedAt) {
            this.name = Objects.requireNonNull(name, "name");
            this.directory = directory;
            this.size = size;
            this.modifiedAt = modifiedAt == null ? Instant.EPOCH : modifiedAt;
        }

        public String name() { return name; }
        public boolean directory() { return directory; }
        public long size() { return size; }
        public Instant modifiedAt() { return modifiedAt; }
    }

    public static final class FileStat {
        private final long size;
        private final Instant modifiedAt;
        private final boolean directory;

        public FileStat(long size, Instant modifiedAt, boolean directory) {
            this.size = size;
            this.modifiedAt = modifiedAt;
            this.directory = directory;
        }

        public long size() { return size; }
        public Instant modifiedAt() { return modifiedAt; }
        public boolean directory() { return directory; }
    }

    /** Junta segmentos com "/" ignorando vazios e barras nas pontas. */
    public static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String p : parts) {
            if (p == null) continue;
            String trimmed = trimSlashes(p);
            if (trimmed.isEmpty()) continue;
            if (sb.length() > 0) sb.append('/');
            sb.append(trimmed);
        }
        return sb.toString();
    }

    public static String trimSlashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '/') start++;
        while (end > start && s.charAt(end - 1) == '/') end--;
        return s.substring(start, end);
    }

    /** Implementação sobre java.nio, presa a um diretório base. */
    public static final class LocalFileSystem implements NativeFileSystem {
        private static final Logger log = LoggerFactory.getLogger(LocalFileSystem.class);
        private final Path base;

        public LocalFileSystem(Path base) throws IOException {
            this.base = Objects.requireNonNull(base, "base").toAbsolutePath().normalize();
            Files.createDirectories(this.base);
        }

        public Path base() { return base; }

        /** Resolve e recusa caminhos que escapem da base. */
        Path resolve(String relative) throws IOException {
            Path p = base.resolve(trimSlashes(Objects.requireNonNull(relative, "path"))).normalize();
            if (!p.startsWith(base)) {
                throw new IOException("Caminho fora da base: " + relative);
            }
            return p;
        }

        @Override
        public List<DirEntry> list(String dir) throws IOException {
            Path p = resolve(dir);
            if (!Files.isDirectory(p)) {
                throw new NoSuchFileException(p.toString());
            }
            List<DirEntry> out = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(p)) {
                for (Path child : stream) {
                    BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class);
                    out.add(new DirEntry(child.getFileName().toString(), attrs.isDirectory(),
                            attrs.isDirectory() ? 0L : attrs.size(), attrs.lastModifiedTime().toInstant()));
                }
            }
            out.sort(Comparator.comparing(DirEntry::name));
            return out;
        }

        @Override
        public Optional<FileStat> stat(String path) throws IOException {
            Path p = resolve(path);
            if (!Files.exists(p)) return Optional.empty();
            BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
            return Optional.of(new FileStat(attrs.size(), attrs.lastModifiedTime().toInstant(), attrs.isDirectory()));
        }

        @Override
        public byte[] read(String path) throws IOException {
            return Files.readAllBytes(resolve(path));
        }

        @Override
        public void write(String path, InputStream content) throws IOException {
            Path target = resolve(path);
            Path parent = target.getParent();
            if (parent == null || !Files.isDirectory(parent)) {
                throw new NoSuchFileException(String.valueOf(parent), null, "diretório pai inexistente");
            }
            Path tmp = Files.createTempFile(parent, ".write-", ".tmp");
            try {
                try (OutputStream out = Files.newOutputStream(tmp)) {
                    content.transferTo(out);
                }
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (IOException moveEx) {
                    log.debug("ATOMIC_MOVE falhou ({}), usando move simples", moveEx.toString());
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Não foi possível remover temporário {}: {}", tmp, e.toString());
                }
            }
        }

        @Override
        public void mkdirs(String dir) throws IOException {
            Files.createDirectories(resolve(dir));
        }

        @Override
        public void delete(String path) throws IOException {
            Files.deleteIfExists(resolve(path));
        }
    }

    // ---- Storage remoto --------------------------------------------------

    /**
     * Capacidade consumida do serviço remoto de pastas (Drive).
     */
    public interface RemoteStorage {

        RemoteFile createFolder(String parentId, String name) throws IOException;

        /** Todos os filhos diretos da pasta (arquivos e pastas), sem itens na lixeira. */
        List<RemoteFile> listFiles(String parentId) throws IOException;

        /**
         * Cria o arquivo, ou substitui o conteúdo de {@code existingFileId} quando informado.
         */
        RemoteFile upload(String parentId, String name, String mimeType, byte[] content, String existingFileId) throws IOException;

        default RemoteFile uploadFile(String parentId, String name, String mimeType, Path content, String existingFileId)
                throws IOException {
            return upload(parentId, name, mimeType, Files.readAllBytes(content), existingFileId);
        }

        void delete(String fileId) throws IOException;

        byte[] fetch(String fileId) throws IOException;

        default void download(String fileId, Path target) throws IOException {
            Files.write(target, fetch(fileId));
        }
    }

    public static final class RemoteFile {
        private final String id;
        private final String name;
        private final String mimeType;
        private final Instant modifiedTime;
        private final long size;

        public RemoteFile(String id, String name, String mimeType, Instant modifiedTime, long size) {
            this.id = Objects.requireNonNull(id, "id");
            this.name = Objects.requireNonNull(name, "name");
            this.mimeType = mimeType;
            this.modifiedTime = modifiedTime;
            this.size = size;
        }

        public String id() { return id; }
        public String name() { return name; }
        public String mimeType() { return mimeType; }
        public Optional<Instant> modifiedTime() { return Optional.ofNullable(modifiedTime); }
        public long size() { return size; }

        public boolean isFolder() { return FOLDER_MIME_TYPE.equals(mimeType); }

        /** Extensão em minúsculas sem o ponto; vazio quando não houver. */
        public String extension() {
            int dot = name.lastIndexOf('.');
            return dot < 0 || dot == name.length() - 1 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
        }

        @Override
        public String toString() {
            return "RemoteFile{" + id + ", '" + name + "'}";
        }
    }

    /** Destinos onde um backup pode ser salvo. */
    public enum BackupTarget {
        LOCAL("local"),
        DRIVE("drive");

        private final String wireName;

        BackupTarget(String wireName) { this.wireName = wireName; }

        public String wireName() { return wireName; }

        public static BackupTarget fromWire(String raw) {
            for (BackupTarget t : values()) {
                if (t.wireName.equalsIgnoreCase(raw)) return t;
            }
            throw new IllegalArgumentException("Destino de backup desconhecido: " + raw);
        }
    }
}
