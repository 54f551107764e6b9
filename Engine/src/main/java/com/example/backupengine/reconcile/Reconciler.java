package com.example.backupengine.reconcile;

import com.example.backupengine.library.Library.AudioStatus;
import com.example.backupengine.library.Library.Chapter;
import com.example.backupengine.reconcile.ChapterFileNames.ContentClass;
import com.example.backupengine.session.AuthRequiredException;
import com.example.backupengine.session.SessionManager;
import com.example.backupengine.storage.Storage.RemoteFile;
import com.example.backupengine.storage.Storage.RemoteStorage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciliação dos metadados locais de capítulos com a listagem de uma pasta remota.
 */
public final class Reconciler {

    private Reconciler() {}

    public static final class ScanResult {
        private final List<String> missingTextIds;
        private final List<String> missingAudioIds;
        private final List<RemoteFile> strayFiles;
        private final List<RemoteFile> duplicates;
        private final int totalChecked;
        private final List<Chapter> updatedChapters;
        private final String message;
        private final boolean listingAvailable;

        public ScanResult(List<String> missingTextIds, List<String> missingAudioIds, List<RemoteFile> strayFiles,
                          List<RemoteFile> duplicates, int totalChecked, List<Chapter> updatedChapters,
                          String message, boolean listingAvailable) {
            this.missingTextIds = Collections.unmodifiableList(new ArrayList<>(missingTextIds));
            this.missingAudioIds = Collections.unmodifiableList(new ArrayList<>(missingAudioIds));
            this.strayFiles = Collections.unmodifiableList(new ArrayList<>(strayFiles));
            this.duplicates = Collections.unmodifiableList(new ArrayList<>(duplicates));
            this.totalChecked = totalChecked;
            this.updatedChapters = Collections.unmodifiableList(new ArrayList<>(updatedChapters));
            this.message = message;
            this.listingAvailable = listingAvailable;
        }

        public List<String> missingTextIds() { return missingTextIds; }
        public List<String> missingAudioIds() { return missingAudioIds; }
        public List<RemoteFile> strayFiles() { return strayFiles; }
        public List<RemoteFile> duplicates() { return duplicates; }
        public int totalChecked() { return totalChecked; }
        /** Cópias dos capítulos cujos vínculos remotos mudaram. */
        public List<Chapter> updatedChapters() { return updatedChapters; }
        public String message() { return message; }
        /** false quando a listagem falhou e foi tratada como vazia. */
        public boolean listingAvailable() { return listingAvailable; }
    }

    /**
     * Casamento em camadas, parando na primeira que acertar: id remoto guardado, nome guardado ou
     * construído, e por fim índice inferido do nome entre arquivos da mesma classe ainda livres.
     * Um arquivo casado fica reservado e não pode ser casado por outro capítulo.
     */
    public static final class RemoteReconciler {
        private static final Logger log = LoggerFactory.getLogger(RemoteReconciler.class);

        private static final List<String> EXCLUDED_SUFFIXES = List.of(".json", ".jpg", ".jpeg", ".png", ".webp", ".gif");

        private final SessionManager session;
        private final RemoteStorage remote;

        public RemoteReconciler(SessionManager session, RemoteStorage remote) {
            this.session = Objects.requireNonNull(session, "session");
            this.remote = Objects.requireNonNull(remote, "remote");
        }

        /**
         * @throws AuthRequiredException sem credencial válida, antes de qualquer chamada remota
         */
        public ScanResult scan(String folderId, List<Chapter> chapters) throws AuthRequiredException {
            Objects.requireNonNull(folderId, "folderId");
            Objects.requireNonNull(chapters, "chapters");
            session.accessToken();

            // Uma única listagem por varredura
            List<RemoteFile> listing;
            boolean available = true;
            try {
                listing = List.copyOf(remote.listFiles(folderId));
            } catch (AuthRequiredException e) {
                throw e;
            } catch (IOException e) {
                log.warn("Falha ao listar pasta {} do Drive; tratando como vazia: {}", folderId, e.getMessage());
                listing = List.of();
                available = false;
            }

            Map<String, RemoteFile> byId = new LinkedHashMap<>();
            Map<String, RemoteFile> byName = new LinkedHashMap<>();
            for (RemoteFile f : listing) {
                if (f.isFolder()) continue;
                byId.putIfAbsent(f.id(), f);
                byName.putIfAbsent(f.name(), f);
            }

            Set<String> claimed = new HashSet<>();
            Set<String> claimedNames = new HashSet<>();
            Set<String> claimedKeys = new HashSet<>();
            List<String> missingText = new ArrayList<>();
            List<String> missingAudio = new ArrayList<>();
            List<Chapter> updated = new ArrayList<>();

            for (Chapter chapter : chapters) {
                Chapter next = chapter.copy();
                boolean changed = false;

                Optional<RemoteFile> text = match(listing, byId, byName, claimed, chapter.cloudTextFileId,
                        chapter.textFileName, ChapterFileNames.buildTextName(chapter.index, chapter.title),
                        ContentClass.TEXT, chapter.index);
                if (text.isPresent()) {
                    RemoteFile f = text.get();
                    claim(f, ContentClass.TEXT, chapter.index, claimed, claimedNames, claimedKeys);
                    if (!f.id().equals(next.cloudTextFileId) || !f.name().equals(next.textFileName) || !next.hasTextOnDrive) {
                        next.cloudTextFileId = f.id();
                        next.textFileName = f.name();
                        next.hasTextOnDrive = true;
                        changed = true;
                    }
                } else {
                    missingText.add(chapter.id);
                }

                Optional<RemoteFile> audio = match(listing, byId, byName, claimed, chapter.cloudAudioFileId,
                        chapter.audioFileName, ChapterFileNames.buildAudioName(chapter.index, chapter.title),
                        ContentClass.AUDIO, chapter.index);
                if (audio.isPresent()) {
                    RemoteFile f = audio.get();
                    claim(f, ContentClass.AUDIO, chapter.index, claimed, claimedNames, claimedKeys);
                    if (!f.id().equals(next.cloudAudioFileId) || !f.name().equals(next.audioFileName)
                            || next.audioStatus != AudioStatus.READY) {
                        next.cloudAudioFileId = f.id();
                        next.audioFileName = f.name();
                        next.audioStatus = AudioStatus.READY;
                        changed = true;
                    }
                } else {
                    // Ausência não rebaixa o status: a listagem pode estar parcial ou defasada.
                    missingAudio.add(chapter.id);
                }

                if (changed) {
                    updated.add(next);
                }
            }

            List<RemoteFile> strays = new ArrayList<>();
            List<RemoteFile> duplicates = new ArrayList<>();
            for (RemoteFile f : listing) {
                if (claimed.contains(f.id()) || f.isFolder() || isExcludedName(f.name())) continue;
                if (claimedNames.contains(f.name()) || claimedKeys.contains(key(f))) {
                    duplicates.add(f);
                } else {
                    strays.add(f);
                }
            }

            String message = String.format(Locale.ROOT, "Scan complete. Found %d strays, %d missing audio.",
                    strays.size(), missingAudio.size());
            log.info("Varredura da pasta {}: {} capítulos, {} atualizados, {} soltos, {} duplicados",
                    folderId, chapters.size(), updated.size(), strays.size(), duplicates.size());
            return new ScanResult(missingText, missingAudio, strays, duplicates, chapters.size(), updated, message, available);
        }

        private static Optional<RemoteFile> match(List<RemoteFile> listing,
                                                  Map<String, RemoteFile> byId,
                                                  Map<String, RemoteFile> byName,
                                                  Set<String> claimed,
                                                  String storedId,
                                                  String storedName,
                                                  String builtName,
                                                  ContentClass contentClass,
                                                  int index) {
            if (storedId != null) {
                RemoteFile f = byId.get(storedId);
                if (f != null && !claimed.contains(f.id())) return Optional.of(f);
            }
            for (String name : new String[] {storedName, builtName}) {
                if (name == null) continue;
                RemoteFile f = byName.get(name);
                if (f != null && !claimed.contains(f.id())) return Optional.of(f);
            }
            for (RemoteFile f : listing) {
                if (f.isFolder() || claimed.contains(f.id())) continue;
                if (ContentClass.ofName(f.name()) != contentClass) continue;
                Optional<Integer> inferred = ChapterFileNames.inferIndexFromName(f.name());
                if (inferred.isPresent() && inferred.get() == index) {
                    return Optional.of(f);
                }
            }
            return Optional.empty();
        }

        private static void claim(RemoteFile f, ContentClass contentClass, int index,
                                  Set<String> claimed, Set<String> claimedNames, Set<String> claimedKeys) {
            claimed.add(f.id());
            claimedNames.add(f.name());
            claimedKeys.add(contentClass + ":" + index);
            String fileKey = key(f);
            if (fileKey != null) {
                claimedKeys.add(fileKey);
            }
        }

        /** Chave classe:índice do arquivo, ou null quando não é de capítulo. */
        private static String key(RemoteFile f) {
            ContentClass c = ContentClass.ofName(f.name());
            if (c == ContentClass.OTHER) return null;
            return ChapterFileNames.inferIndexFromName(f.name()).map(i -> c + ":" + i).orElse(null);
        }

        static boolean isExcludedName(String name) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.contains("cover") || lower.contains("manifest")) return true;
            for (String suffix : EXCLUDED_SUFFIXES) {
                if (lower.endsWith(suffix)) return true;
            }
            return false;
        }
    }
}
