package com.example.backupengine.config;

import com.example.backupengine.archive.Archive.Platform;
import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AppConfig
 * ----------
 * Carrega, valida e expõe as configurações do motor de backup.
 *
 * PRINCÍPIOS:
 * - Falhar cedo (validar assim que possível).
 * - Constantes centralizadas para as chaves.
 * - Precedência previsível: System properties > variáveis de ambiente > .env.
 * - Getters tipados com limites (int/long/MB).
 * - toString() sanitizado: o token do Drive nunca aparece em logs.
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Diretório base do filesystem nativo (equivalente ao Directory.Data do app). */
    public static final String DATA_DIR = "TALEVOX_DATA_DIR";
    /** Plataforma declarada no meta.json: android, ios ou web. */
    public static final String PLATFORM = "BACKUP_PLATFORM";
    /** Versão da aplicação gravada no meta.json. */
    public static final String APP_VERSION = "APP_VERSION";

    /** URL base da API do Drive (sem "/" final). */
    public static final String DRIVE_API_BASE_URL = "DRIVE_API_BASE_URL";
    /** Pasta raiz do app no Drive. */
    public static final String DRIVE_ROOT_FOLDER_ID = "DRIVE_ROOT_FOLDER_ID";
    /** Token OAuth já obtido externamente. NÃO logar. */
    public static final String DRIVE_ACCESS_TOKEN = "DRIVE_ACCESS_TOKEN";
    public static final String DRIVE_RETRY_MAX_ATTEMPTS = "DRIVE_RETRY_MAX_ATTEMPTS";
    public static final String DRIVE_RETRY_BASE_DELAY_MS = "DRIVE_RETRY_BASE_DELAY_MS";
    public static final String DRIVE_RETRY_MAX_DELAY_MS = "DRIVE_RETRY_MAX_DELAY_MS";

    /** Limiar (MB) acima do qual um arquivo gera aviso "large-file". */
    public static final String LARGE_FILE_WARNING_MB = "BACKUP_LARGE_FILE_WARNING_MB";
    /** Padrões de retenção quando não há preferência salva. */
    public static final String KEEP_LOCAL = "BACKUP_KEEP_LOCAL";
    public static final String KEEP_DRIVE = "BACKUP_KEEP_DRIVE";
    /** Fuso usado no nome do arquivo de backup. Padrão UTC. */
    public static final String TIMEZONE = "BACKUP_TIMEZONE";

    // ======= ARMAZENAMENTO INTERNO =======

    /** Overrides em runtime (ex.: testes). Têm precedência sobre qualquer fonte. */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados (System properties > ENV > .env). */
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações com a precedência:
     * 1) System properties
     * 2) Variáveis de ambiente
     * 3) Arquivo .env (se existir)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>();

        System.getenv().forEach(map::put);

        // System properties vencem o ambiente
        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        // .env preenche apenas ausentes
        dotenv.entries().forEach(e -> map.putIfAbsent(e.getKey(), e.getValue()));

        return new AppConfig(map);
    }

    /** Útil para testes: cria AppConfig a partir de um Map já resolvido. */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    /** Busca valor (overrides > values) e devolve Optional sem brancos. */
    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    /** Busca valor obrigatório; lança IllegalStateException se ausente. */
    public String require(String key) {
        return find(key).orElseThrow(() -> new IllegalStateException("Configuração obrigatória ausente: " + key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /** Seta/remove override em runtime. value==null remove. */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= GETTERS ESPECÍFICOS =======

    /** Diretório base do filesystem nativo. Padrão: $HOME/talevox-data. */
    public Path dataDir() {
        return Path.of(find(DATA_DIR).orElseGet(() -> System.getProperty("user.home") + "/talevox-data"))
                .toAbsolutePath()
                .normalize();
    }

    /** Plataforma; valores fora de android/ios/web falham cedo. */
    public Platform platform() {
        String raw = getOrDefault(PLATFORM, "android").trim().toLowerCase(Locale.ROOT);
        switch (raw) {
            case "android": return Platform.ANDROID;
            case "ios": return Platform.IOS;
            case "web": return Platform.WEB;
            default: throw new IllegalStateException("BACKUP_PLATFORM inválido: use 'android', 'ios' ou 'web'");
        }
    }

    public String appVersion() {
        return getOrDefault(APP_VERSION, "unknown");
    }

    /** URL base da API do Drive; exige http(s) e remove "/" final. */
    public String driveApiBaseUrl() {
        String raw = getOrDefault(DRIVE_API_BASE_URL, "https://www.googleapis.com").trim();
        if (!raw.startsWith("http")) {
            throw new IllegalStateException("DRIVE_API_BASE_URL deve começar com http/https");
        }
        return raw.endsWith("/") ? raw.substring(0, raw.length() - 1) : raw;
    }

    /** Pasta raiz do app no Drive; sem ela o destino drive fica indisponível. */
    public Optional<String> driveRootFolderId() {
        return find(DRIVE_ROOT_FOLDER_ID);
    }

    /** Token opcional (NÃO logar). */
    public Optional<String> driveAccessToken() {
        return find(DRIVE_ACCESS_TOKEN);
    }

    /** Tentativas por requisição ao Drive. Faixa [1, 10], padrão 4. */
    public int driveRetryMaxAttempts() {
        return intConfig(DRIVE_RETRY_MAX_ATTEMPTS, 4, 1, 10);
    }

    /** Atraso base do backoff. Faixa [50, 10000] ms, padrão 400. */
    public long driveRetryBaseDelayMs() {
        return longConfig(DRIVE_RETRY_BASE_DELAY_MS, 400, 50, 10_000);
    }

    /** Teto do backoff; nunca menor que o atraso base. Padrão 4000 ms. */
    public long driveRetryMaxDelayMs() {
        long base = driveRetryBaseDelayMs();
        return Math.max(base, longConfig(DRIVE_RETRY_MAX_DELAY_MS, 4000, 50, 60_000));
    }

    /** Limiar de "large-file" em bytes. Padrão 50 MB, mínimo 1 MB. */
    public long largeFileWarningBytes() {
        return longConfig(LARGE_FILE_WARNING_MB, 50, 1, 1024 * 1024) * 1024L * 1024L;
    }

    public int keepLocalBackups() {
        return intConfig(KEEP_LOCAL, 10, 1, 1000);
    }

    public int keepDriveBackups() {
        return intConfig(KEEP_DRIVE, 10, 1, 1000);
    }

    /** Fuso para o nome do arquivo; inválido cai em UTC. */
    public ZoneId backupZone() {
        String raw = getOrDefault(TIMEZONE, "UTC");
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }

    // ======= HELPERS TIPADOS =======

    /** Parser long com faixa [min, max]; se inválido, retorna default. */
    private long longConfig(String key, long def, long min, long max) {
        String raw = getOrDefault(key, Long.toString(def));
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** Parser int com faixa [min, max]; se inválido, retorna default. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    // ======= LOGGING SEGURO =======

    @Override
    public String toString() {
        String platform = safe(() -> platform().wireName());
        String driveUrl = safe(this::driveApiBaseUrl);
        String root = safe(() -> find(DRIVE_ROOT_FOLDER_ID).orElse("unset"));

        return "AppConfig{" +
                "dataDir=" + dataDir() +
                ", platform=" + platform +
                ", appVersion=" + appVersion() +
                ", driveUrl=" + driveUrl +
                ", driveRoot=" + root +
                ", driveToken=" + (driveAccessToken().isPresent() ? "set" : "unset") +
                ", keepLocal=" + keepLocalBackups() +
                ", keepDrive=" + keepDriveBackups() +
                "}";
    }

    private static String safe(SupplierLike supplier) {
        try { return supplier.get(); } catch (RuntimeException e) { return "error:" + e.getClass().getSimpleName(); }
    }

    @FunctionalInterface
    private interface SupplierLike { String get(); }
}
