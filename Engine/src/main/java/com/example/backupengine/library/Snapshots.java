package com.example.backupengine.library;

import com.example.backupengine.library.Library.Attachment;
import com.example.backupengine.library.Library.BackupContext;
import com.example.backupengine.library.Library.Chapter;
import com.example.backupengine.library.Library.FullSnapshot;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.ToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fronteira com o colaborador que produz o snapshot completo em memória.
 */
public final class Snapshots {

    private Snapshots() {}

    /** Produz o snapshot a partir do contexto; exceções aqui abortam o backup. */
    public interface SnapshotBuilder {
        FullSnapshot build(BackupContext context) throws IOException;
    }

    /**
     * Implementação padrão: copia o contexto, remove duplicatas por id (vence o updatedAt mais novo)
     * e ordena capítulos por livro e índice.
     */
    public static final class DefaultSnapshotBuilder implements SnapshotBuilder {
        private static final Logger log = LoggerFactory.getLogger(DefaultSnapshotBuilder.class);

        private final String appVersion;
        private final Clock clock;

        public DefaultSnapshotBuilder(String appVersion) {
            this(appVersion, Clock.systemUTC());
        }

        public DefaultSnapshotBuilder(String appVersion, Clock clock) {
            this.appVersion = Objects.requireNonNull(appVersion, "appVersion");
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        @Override
        public FullSnapshot build(BackupContext context) {
            Objects.requireNonNull(context, "context");
            FullSnapshot snapshot = new FullSnapshot();
            snapshot.createdAt = clock.millis();
            snapshot.appVersion = appVersion;
            snapshot.preferences = new LinkedHashMap<>(context.preferences());
            snapshot.readerProgress = context.readerProgress();
            snapshot.legacyProgressStore = context.legacyProgressStore();
            snapshot.globalRules = context.globalRules();
            snapshot.uiState = context.uiState();

            snapshot.books = dedupe(context.books(), b -> b.id, b -> b.updatedAt == null ? 0L : b.updatedAt);
            List<Chapter> chapters = dedupe(context.chapters(), c -> c.id, c -> c.updatedAt == null ? 0L : c.updatedAt);
            chapters.sort(Comparator.comparing((Chapter c) -> c.bookId == null ? "" : c.bookId)
                    .thenComparingInt(c -> c.index));
            snapshot.chapters = chapters;
            snapshot.attachments = dedupe(context.attachments(), a -> a.id, a -> a.updatedAt == null ? 0L : a.updatedAt);
            snapshot.jobs = dedupe(context.jobs(), j -> j.id, j -> j.updatedAt == null ? 0L : j.updatedAt);

            log.debug("Snapshot montado: {} livros, {} capítulos, {} anexos, {} jobs",
                    snapshot.books.size(), snapshot.chapters.size(), snapshot.attachments.size(), snapshot.jobs.size());
            return snapshot;
        }

        /** Mantém a ordem de primeira aparição; itens sem id são descartados. */
        static <T> List<T> dedupe(List<T> items, Function<T, String> id, ToLongFunction<T> updatedAt) {
            Map<String, T> byId = new LinkedHashMap<>();
            for (T item : items) {
                if (item == null) continue;
                String key = id.apply(item);
                if (key == null || key.isBlank()) continue;
                T current = byId.get(key);
                if (current == null || updatedAt.applyAsLong(item) > updatedAt.applyAsLong(current)) {
                    byId.put(key, item);
                }
            }
            return new ArrayList<>(byId.values());
        }
    }

    /** Agrupa anexos por livro preservando a ordem; usado no replay do snapshot. */
    public static Map<String, List<Attachment>> attachmentsByBook(List<Attachment> attachments) {
        Map<String, List<Attachment>> grouped = new LinkedHashMap<>();
        for (Attachment a : attachments) {
            if (a == null || a.bookId == null) continue;
            grouped.computeIfAbsent(a.bookId, k -> new ArrayList<>()).add(a);
        }
        return grouped;
    }

    /** Agrupa capítulos por livro preservando a ordem. */
    public static Map<String, List<Chapter>> chaptersByBook(List<Chapter> chapters) {
        Map<String, List<Chapter>> grouped = new LinkedHashMap<>();
        for (Chapter c : chapters) {
            if (c == null || c.bookId == null) continue;
            grouped.computeIfAbsent(c.bookId, k -> new ArrayList<>()).add(c);
        }
        return grouped;
    }
}
