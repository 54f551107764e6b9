package com.example.backupengine.archive;

import java.io.IOException;

/**
 * Arquivo de backup inutilizável: entrada obrigatória ausente ou metadados inválidos.
 */
public class ArchiveFormatException extends IOException {

    private final String entryName;

    public ArchiveFormatException(String entryName, String message) {
        super(message);
        this.entryName = entryName;
    }

    public ArchiveFormatException(String entryName, String message, Throwable cause) {
        super(message, cause);
        this.entryName = entryName;
    }

    /** Entrada do ZIP que causou a falha. */
    public String entryName() {
        return entryName;
    }
}
