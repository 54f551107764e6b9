package com.example.backupengine.restore;

import com.example.backupengine.archive.Archive;
import com.example.backupengine.archive.Archive.ArchiveBundle;
import com.example.backupengine.archive.Archive.ArchiveMeta;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normaliza a versão do schema do bundle para a atual. Nunca rebaixa a versão.
 */
public final class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    private final int currentVersion;

    public SchemaMigrator() {
        this(Archive.CURRENT_SCHEMA_VERSION);
    }

    public SchemaMigrator(int currentVersion) {
        this.currentVersion = currentVersion;
    }

    public int currentVersion() {
        return currentVersion;
    }

    /**
     * @throws UnsupportedSchemaException se o bundle for de um schema mais novo
     */
    public ArchiveBundle migrate(ArchiveBundle bundle) throws UnsupportedSchemaException {
        Objects.requireNonNull(bundle, "bundle");
        ArchiveMeta meta = bundle.meta();
        int from = meta.schemaVersion();
        if (from == currentVersion) {
            return bundle;
        }
        if (from > currentVersion) {
            throw new UnsupportedSchemaException(from, currentVersion);
        }
        // Schemas antigos só diferem na versão declarada; o conteúdo é lido de forma tolerante.
        log.info("Migrando backup do schema {} para {}", from, currentVersion);
        ArchiveMeta migrated = meta.withSchemaVersion(currentVersion)
                .withWarning("Backup migrated from schema " + from + " to " + currentVersion);
        return bundle.withMeta(migrated);
    }
}
