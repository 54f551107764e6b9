package com.example.backupengine.session;

import java.io.IOException;

/**
 * Não há credencial remota válida. Classificação {@value #CODE} para quem chama.
 */
public class AuthRequiredException extends IOException {

    public static final String CODE = "AUTH_REQUIRED";

    public AuthRequiredException(String message) {
        super(message);
    }

    public AuthRequiredException(String message, Throwable cause) {
        super(message, cause);
    }

    public String code() {
        return CODE;
    }
}
