package com.example.backupengine.session;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mantém em memória a credencial OAuth do Drive e a entrega para o gateway e o reconciliador.
 * <p>
 * A obtenção e a renovação do token são do {@link TokenSource}; aqui só há cache, expiração
 * e falha previsível ({@link AuthRequiredException}) quando não houver credencial.
 */
public final class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    /** Capacidade externa que fornece ou renova o bearer token. */
    public interface TokenSource {
        /** Token atual conhecido pela fonte, se houver. */
        Optional<AccessToken> current() throws IOException;

        /** Renova o token; falha com IOException se não for possível. */
        AccessToken refresh() throws IOException;
    }

    public static final class AccessToken {
        private final String value;
        private final Instant expiresAt;

        public AccessToken(String value, Instant expiresAt) {
            this.value = Objects.requireNonNull(value, "value");
            this.expiresAt = expiresAt;
        }

        public String value() { return value; }
        public Optional<Instant> expiresAt() { return Optional.ofNullable(expiresAt); }

        /** Margem de 30s para não enviar um token prestes a expirar. */
        public boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt.minusSeconds(30));
        }
    }

    /** Token fixo, vindo de configuração; sem renovação. */
    public static final class StaticTokenSource implements TokenSource {
        private final AccessToken token;

        public StaticTokenSource(String token) {
            this.token = token == null || token.isBlank() ? null : new AccessToken(token, null);
        }

        @Override
        public Optional<AccessToken> current() {
            return Optional.ofNullable(token);
        }

        @Override
        public AccessToken refresh() throws IOException {
            throw new AuthRequiredException("Token estático não pode ser renovado");
        }
    }

    private final TokenSource source;
    private final Clock clock;
    private final AtomicReference<AccessToken> cached = new AtomicReference<>();
    private final Object refreshLock = new Object();

    public SessionManager(TokenSource source) {
        this(source, Clock.systemUTC());
    }

    public SessionManager(TokenSource source, Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Indica se existe um token não expirado, sem tentar renovar. */
    public boolean hasValidToken() {
        try {
            AccessToken t = currentToken();
            return t != null && !t.isExpired(clock.instant());
        } catch (IOException e) {
            log.debug("Fonte de token indisponível: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Recupera um access token válido, renovando com exclusão mútua se expirado.
     *
     * @throws AuthRequiredException se não houver token ou a renovação falhar
     */
    public String accessToken() throws AuthRequiredException {
        AccessToken t = currentTokenOrFail();
        if (!t.isExpired(clock.instant())) {
            return t.value();
        }

        // Double-check locking para evitar refresh concorrente desnecessário
        synchronized (refreshLock) {
            AccessToken current = currentTokenOrFail();
            if (current.isExpired(clock.instant())) {
                current = refresh();
            }
            return current.value();
        }
    }

    /** Descarta o token em cache (ex.: após HTTP 401). */
    public void invalidate() {
        cached.set(null);
    }

    private AccessToken currentToken() throws IOException {
        AccessToken t = cached.get();
        if (t != null) {
            return t;
        }
        Optional<AccessToken> fromSource = source.current();
        fromSource.ifPresent(cached::set);
        return fromSource.orElse(null);
    }

    private AccessToken currentTokenOrFail() throws AuthRequiredException {
        try {
            AccessToken t = currentToken();
            if (t == null) {
                throw new AuthRequiredException("Nenhuma sessão do Drive ativa");
            }
            return t;
        } catch (AuthRequiredException e) {
            throw e;
        } catch (IOException e) {
            throw new AuthRequiredException("Falha ao obter token do Drive: " + e.getMessage(), e);
        }
    }

    private AccessToken refresh() throws AuthRequiredException {
        try {
            AccessToken renewed = source.refresh();
            cached.set(renewed);
            return renewed;
        } catch (AuthRequiredException e) {
            invalidate();
            throw e;
        } catch (IOException e) {
            // Falha remota: limpa o cache para não manter token zumbi
            invalidate();
            throw new AuthRequiredException("Sessão expirada e renovação falhou: " + e.getMessage(), e);
        }
    }
}
