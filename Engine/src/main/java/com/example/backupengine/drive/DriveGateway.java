package com.example.backupengine.drive;

import com.example.backupengine.config.AppConfig;
import com.example.backupengine.session.AuthRequiredException;
import com.example.backupengine.session.SessionManager;
import com.example.backupengine.storage.Storage;
import com.example.backupengine.storage.Storage.RemoteFile;
import com.example.backupengine.storage.Storage.RemoteStorage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cliente REST enxuto para a API v3 do Drive, implementando {@link RemoteStorage}. Inclui:
 * - timeouts sensatos no HTTP;
 * - retries exponenciais com jitter para 429/5xx;
 * - paginação da listagem por pasta;
 * - HTTP 401 mapeado para {@link AuthRequiredException}.
 */
public final class DriveGateway implements RemoteStorage {

    private static final Logger log = LoggerFactory.getLogger(DriveGateway.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType MULTIPART_RELATED = MediaType.get("multipart/related");
    private static final Set<Integer> RETRYABLE_STATUS = Set.of(429, 500, 502, 503, 504);
    private static final String FILE_FIELDS = "id,name,mimeType,modifiedTime,size";

    private final String baseUrl;
    private final SessionManager session;
    private final OkHttpClient httpClient;
    private final RetryPolicy retry;
    private final ObjectMapper mapper = new ObjectMapper();

    /** Política de retry: tentativas, atraso base e teto (ms). */
    public static final class RetryPolicy {
        private final int maxAttempts;
        private final long baseDelayMs;
        private final long maxDelayMs;

        public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs) {
            this.maxAttempts = Math.max(1, maxAttempts);
            this.baseDelayMs = Math.max(1, baseDelayMs);
            this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        }

        public static RetryPolicy from(AppConfig config) {
            return new RetryPolicy(config.driveRetryMaxAttempts(), config.driveRetryBaseDelayMs(), config.driveRetryMaxDelayMs());
        }

        public int maxAttempts() { return maxAttempts; }

        long delayFor(int attempt) {
            long exponential = Math.min(maxDelayMs, baseDelayMs * (1L << Math.min(20, attempt - 1)));
            double jitter = exponential * (0.5 + ThreadLocalRandom.current().nextDouble() * 0.5);
            return Math.min(maxDelayMs, (long) jitter);
        }
    }

    // ---- Construtores -----------------------------------------------------

    public DriveGateway(AppConfig config, SessionManager session) {
        this(config.driveApiBaseUrl(), session, defaultHttp(), RetryPolicy.from(config));
    }

    public DriveGateway(String baseUrl, SessionManager session, OkHttpClient httpClient, RetryPolicy retry) {
        String url = Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.session = Objects.requireNonNull(session, "session");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.retry = Objects.requireNonNull(retry, "retry");
    }

    private static OkHttpClient defaultHttp() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(30))
                .readTimeout(Duration.ofMinutes(5))
                .writeTimeout(Duration.ofMinutes(5))
                .build();
    }

    // ---- RemoteStorage ----------------------------------------------------

    @Override
    public RemoteFile createFolder(String parentId, String name) throws IOException {
        ObjectNode meta = mapper.createObjectNode();
        meta.put("name", name);
        meta.put("mimeType", Storage.FOLDER_MIME_TYPE);
        meta.putArray("parents").add(parentId);
        HttpUrl url = apiUrl("drive/v3/files").addQueryParameter("fields", FILE_FIELDS).build();
        JsonNode node = executeForJson(() -> authorized(url).post(RequestBody.create(meta.toString(), JSON)).build(),
                "createFolder");
        return toRemoteFile(node);
    }

    @Override
    public List<RemoteFile> listFiles(String parentId) throws IOException {
        Objects.requireNonNull(parentId, "parentId");
        List<RemoteFile> out = new ArrayList<>();
        String pageToken = null;
        do {
            HttpUrl.Builder b = apiUrl("drive/v3/files")
                    .addQueryParameter("q", "'" + parentId.replace("'", "\\'") + "' in parents and trashed = false")
                    .addQueryParameter("fields", "nextPageToken,files(" + FILE_FIELDS + ")")
                    .addQueryParameter("pageSize", "1000");
            if (pageToken != null) {
                b.addQueryParameter("pageToken", pageToken);
            }
            HttpUrl url = b.build();
            JsonNode node = executeForJson(() -> authorized(url).get().build(), "listFiles");
            JsonNode files = node == null ? null : node.get("files");
            if (files != null && files.isArray()) {
                for (JsonNode f : files) {
                    out.add(toRemoteFile(f));
                }
            }
            pageToken = node != null && node.hasNonNull("nextPageToken") ? node.get("nextPageToken").asText() : null;
        } while (pageToken != null && !pageToken.isBlank());
        return out;
    }

    @Override
    public RemoteFile upload(String parentId, String name, String mimeType, byte[] content, String existingFileId)
            throws IOException {
        RequestBody media = RequestBody.create(content, MediaType.parse(mimeType));
        return multipartUpload(parentId, name, mimeType, media, existingFileId);
    }

    @Override
    public RemoteFile uploadFile(String parentId, String name, String mimeType, Path content, String existingFileId)
            throws IOException {
        RequestBody media = RequestBody.create(content.toFile(), MediaType.parse(mimeType));
        return multipartUpload(parentId, name, mimeType, media, existingFileId);
    }

    @Override
    public void delete(String fileId) throws IOException {
        HttpUrl url = apiUrl("drive/v3/files").addPathSegment(fileId).build();
        executeForJson(() -> authorized(url).delete().build(), "delete");
    }

    @Override
    public byte[] fetch(String fileId) throws IOException {
        HttpUrl url = apiUrl("drive/v3/files").addPathSegment(fileId).addQueryParameter("alt", "media").build();
        return withRetry("fetch", () -> {
            try (Response response = httpClient.newCall(authorized(url).get().build()).execute()) {
                ensureSuccess(response, "fetch");
                ResponseBody body = response.body();
                return body != null ? body.bytes() : new byte[0];
            }
        });
    }

    @Override
    public void download(String fileId, Path target) throws IOException {
        HttpUrl url = apiUrl("drive/v3/files").addPathSegment(fileId).addQueryParameter("alt", "media").build();
        withRetry("download", () -> {
            try (Response response = httpClient.newCall(authorized(url).get().build()).execute()) {
                ensureSuccess(response, "download");
                ResponseBody body = response.body();
                if (body == null) throw new IOException("Drive devolveu corpo vazio para " + fileId);
                try (InputStream in = body.byteStream()) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                return null;
            }
        });
    }

    // ---- Upload multipart -------------------------------------------------

    private RemoteFile multipartUpload(String parentId, String name, String mimeType, RequestBody media,
                                       String existingFileId) throws IOException {
        ObjectNode meta = mapper.createObjectNode();
        meta.put("name", name);
        meta.put("mimeType", mimeType);
        boolean update = existingFileId != null && !existingFileId.isBlank();
        if (!update) {
            meta.putArray("parents").add(parentId);
        }
        RequestBody body = new MultipartBody.Builder()
                .setType(MULTIPART_RELATED)
                .addPart(RequestBody.create(meta.toString(), JSON))
                .addPart(media)
                .build();

        HttpUrl.Builder url = apiUrl("upload/drive/v3/files");
        if (update) {
            url.addPathSegment(existingFileId);
        }
        HttpUrl target = url.addQueryParameter("uploadType", "multipart")
                .addQueryParameter("fields", FILE_FIELDS)
                .build();

        JsonNode node = executeForJson(() -> {
            Request.Builder b = authorized(target);
            return update ? b.patch(body).build() : b.post(body).build();
        }, update ? "update" : "upload");
        log.debug("Arquivo {} enviado ao Drive ({})", name, update ? "atualização" : "novo");
        return toRemoteFile(node);
    }

    // ---- Infra HTTP -------------------------------------------------------

    private HttpUrl.Builder apiUrl(String path) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalStateException("DRIVE_API_BASE_URL inválida: " + baseUrl);
        }
        return base.newBuilder().addPathSegments(path);
    }

    private Request.Builder authorized(HttpUrl url) throws AuthRequiredException {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + session.accessToken())
                .header("Accept", "application/json");
    }

    @FunctionalInterface
    private interface RequestFactory {
        Request create() throws IOException;
    }

    @FunctionalInterface
    private interface HttpCall<T> {
        T call() throws IOException;
    }

    private JsonNode executeForJson(RequestFactory factory, String label) throws IOException {
        return withRetry(label, () -> {
            try (Response response = httpClient.newCall(factory.create()).execute()) {
                ensureSuccess(response, label);
                ResponseBody body = response.body();
                String raw = body != null ? body.string() : "";
                return raw.isBlank() ? null : mapper.readTree(raw);
            }
        });
    }

    private void ensureSuccess(Response response, String label) throws IOException {
        if (response.isSuccessful()) {
            return;
        }
        int code = response.code();
        if (code == 401) {
            session.invalidate();
            throw new AuthRequiredException("Drive recusou a credencial (HTTP 401) em " + label);
        }
        ResponseBody body = response.body();
        String detail = body != null ? body.string() : "";
        throw new DriveHttpException(code, label + " falhou com HTTP " + code + ": "
                + (detail.isBlank() ? "<no-body>" : detail));
    }

    private <T> T withRetry(String label, HttpCall<T> call) throws IOException {
        IOException last = null;
        for (int attempt = 1; attempt <= retry.maxAttempts(); attempt++) {
            try {
                return call.call();
            } catch (AuthRequiredException e) {
                throw e;
            } catch (DriveHttpException e) {
                if (!RETRYABLE_STATUS.contains(e.status())) {
                    throw e;
                }
                last = e;
            } catch (IOException e) {
                // falha de rede: também tentamos de novo
                last = e;
            }
            if (attempt < retry.maxAttempts()) {
                long delay = retry.delayFor(attempt);
                log.debug("{}: tentativa {} falhou ({}), aguardando {} ms", label, attempt, last.getMessage(), delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrompido", ie);
                }
            }
        }
        log.warn("{} falhou após {} tentativas: {}", label, retry.maxAttempts(), last.getMessage());
        throw last;
    }

    private RemoteFile toRemoteFile(JsonNode node) throws IOException {
        if (node == null || !node.hasNonNull("id")) {
            throw new IOException("Drive não retornou id válido");
        }
        Instant modified = null;
        if (node.hasNonNull("modifiedTime")) {
            try {
                modified = Instant.parse(node.get("modifiedTime").asText());
            } catch (DateTimeParseException e) {
                log.debug("modifiedTime ilegível: {}", node.get("modifiedTime").asText());
            }
        }
        return new RemoteFile(node.get("id").asText(),
                node.path("name").asText(""),
                node.path("mimeType").asText(null),
                modified,
                node.path("size").asLong(0L));
    }

    /** Resposta HTTP não bem-sucedida, com o status preservado para a decisão de retry. */
    public static final class DriveHttpException extends IOException {
        private final int status;

        public DriveHttpException(int status, String message) {
            super(message);
            this.status = status;
        }

        public int status() { return status; }
    }
}
