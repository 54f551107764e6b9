package com.example.backupengine.restore;

import java.io.IOException;

/**
 * Backup gerado por uma versão do app mais nova que esta.
 */
public class UnsupportedSchemaException extends IOException {

    private final int schemaVersion;
    private final int supportedVersion;

    public UnsupportedSchemaException(int schemaVersion, int supportedVersion) {
        super("Unsupported backup schema " + schemaVersion + ". App supports up to " + supportedVersion + ".");
        this.schemaVersion = schemaVersion;
        this.supportedVersion = supportedVersion;
    }

    public int schemaVersion() { return schemaVersion; }
    public int supportedVersion() { return supportedVersion; }
}
