package com.example.backupengine.prefs;

import com.example.backupengine.archive.Archive;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store chave/valor de preferências e as chaves que participam do backup.
 */
public final class Preferences {

    private Preferences() {}

    /** Capacidade consumida: store chave/valor plano (string → string). */
    public interface PreferenceStore {
        Optional<String> get(String key) throws IOException;

        void set(String key, String value) throws IOException;

        void remove(String key) throws IOException;

        Set<String> keys() throws IOException;

        /** Entradas cujo nome começa com {@code prefix}, ordenadas pela chave. */
        default Map<String, String> entriesWithPrefix(String prefix) throws IOException {
            Map<String, String> out = new TreeMap<>();
            for (String key : keys()) {
                if (key.startsWith(prefix)) {
                    get(key).ifPresent(v -> out.put(key, v));
                }
            }
            return out;
        }
    }

    // ---- Chaves ----------------------------------------------------------

    public static final class PreferenceKeys {
        private static final String P = Archive.PRODUCT;

        /** Chaves seguras copiadas para prefs.json. */
        public static final List<String> SAFE_KEYS = List.of(
                P + "_prefs_v3",
                P + "_reader_progress",
                P + "_progress_store",
                P + "_nav_context_v1",
                P + "_ui_mode",
                P + "_sync_diag",
                P + "_launch_sync_v1",
                P + "_last_fatal_error",
                P + "_full_snapshot_meta_v1",
                P + "_saved_snapshot_v1",
                P + "_backup_settings_v1");

        /** Família por prefixo (modo de visualização por livro). */
        public static final String VIEW_MODE_PREFIX = P + ":viewMode:";

        /** Credenciais: só entram com includeOAuthTokens=true. */
        public static final Set<String> OAUTH_KEYS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
                P + "_drive_token_v2",
                P + "_drive_session_v3")));

        public static final String BACKUP_SETTINGS = P + "_backup_settings_v1";
        public static final String RESTORE_WARNINGS = P + "_restore_warnings_v1";

        private PreferenceKeys() {}

        public static boolean isOAuthKey(String key) {
            return OAUTH_KEYS.contains(key);
        }
    }

    // ---- Implementações --------------------------------------------------

    /** Store em memória; usado em plataformas sem persistência e nos testes. */
    public static final class InMemoryPreferenceStore implements PreferenceStore {
        private final Map<String, String> values = Collections.synchronizedMap(new LinkedHashMap<>());

        public InMemoryPreferenceStore() {}

        public InMemoryPreferenceStore(Map<String, String> initial) {
            values.putAll(initial);
        }

        @Override public Optional<String> get(String key) { return Optional.ofNullable(values.get(key)); }
        @Override public void set(String key, String value) { values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value")); }
        @Override public void remove(String key) { values.remove(key); }

        @Override
        public Set<String> keys() {
            synchronized (values) {
                return new LinkedHashSet<>(values.keySet());
            }
        }

        public Map<String, String> snapshot() {
            synchronized (values) {
                return new LinkedHashMap<>(values);
            }
        }
    }

    /**
     * Store persistido num único arquivo JSON. Cada escrita regrava o arquivo via temp + move.
     */
    public static final class FilePreferenceStore implements PreferenceStore {
        private static final Logger log = LoggerFactory.getLogger(FilePreferenceStore.class);
        private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {};

        private final Path file;
        private final ObjectMapper mapper;
        private final Map<String, String> values;

        public FilePreferenceStore(Path file, ObjectMapper mapper) throws IOException {
            this.file = Objects.requireNonNull(file, "file");
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            this.values = load();
        }

        private Map<String, String> load() throws IOException {
            if (!Files.exists(file)) {
                return new LinkedHashMap<>();
            }
            try {
                return mapper.readValue(file.toFile(), MAP_TYPE);
            } catch (IOException e) {
                log.warn("Arquivo de preferências ilegível ({}); iniciando vazio: {}", file, e.getMessage());
                return new LinkedHashMap<>();
            }
        }

        @Override
        public synchronized Optional<String> get(String key) {
            return Optional.ofNullable(values.get(key));
        }

        @Override
        public synchronized void set(String key, String value) throws IOException {
            values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            flush();
        }

        @Override
        public synchronized void remove(String key) throws IOException {
            if (values.remove(key) != null) {
                flush();
            }
        }

        @Override
        public synchronized Set<String> keys() {
            return new LinkedHashSet<>(values.keySet());
        }

        private void flush() throws IOException {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), values);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
