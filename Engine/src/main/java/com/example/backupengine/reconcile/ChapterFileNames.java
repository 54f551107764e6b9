package com.example.backupengine.reconcile;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Nomes canônicos de arquivos de capítulo e inferência de índice a partir de nomes livres.
 * Funções puras.
 */
public final class ChapterFileNames {

    private ChapterFileNames() {}

    public static final Set<String> TEXT_EXTENSIONS = Set.of("txt", "md");
    public static final Set<String> AUDIO_EXTENSIONS = Set.of("mp3", "wav", "m4a");

    static final int MAX_TITLE_LENGTH = 80;

    private static final Pattern ILLEGAL = Pattern.compile("[\\\\/:*?\"<>|]");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^0*(\\d+)");
    private static final Pattern CHAPTER_NUMBER = Pattern.compile(
            "(?i)\\b(?:chapter|chap|ch|c|cap[ií]tulo|cap)[\\s._-]*0*(\\d+)");

    /** Classe de conteúdo de um arquivo remoto, pela extensão. */
    public enum ContentClass {
        TEXT, AUDIO, OTHER;

        public static ContentClass ofName(String name) {
            String ext = extension(name);
            if (TEXT_EXTENSIONS.contains(ext)) return TEXT;
            if (AUDIO_EXTENSIONS.contains(ext)) return AUDIO;
            return OTHER;
        }
    }

    /** Ex.: {@code buildTextName(7, "O Fim")} → {@code 007_O Fim.txt}. */
    public static String buildTextName(int index, String title) {
        return String.format(Locale.ROOT, "%03d_%s.txt", index, sanitize(title));
    }

    public static String buildAudioName(int index, String title) {
        return String.format(Locale.ROOT, "%03d_%s.mp3", index, sanitize(title));
    }

    static String sanitize(String title) {
        String s = title == null ? "" : ILLEGAL.matcher(title).replaceAll("_");
        s = SPACES.matcher(s).replaceAll(" ").trim();
        if (s.length() > MAX_TITLE_LENGTH) {
            s = s.substring(0, MAX_TITLE_LENGTH).trim();
        }
        return s.isEmpty() ? "Chapter" : s;
    }

    /**
     * Índice ordinal sugerido pelo nome: número inicial ("007_x.txt") ou marcador de capítulo
     * ("Chapter 12.txt", "cap-03.mp3"). Vazio quando não há número reconhecível.
     */
    public static Optional<Integer> inferIndexFromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String base = stripExtension(name.trim());
        Matcher m = LEADING_NUMBER.matcher(base);
        if (m.find()) {
            return parse(m.group(1));
        }
        m = CHAPTER_NUMBER.matcher(base);
        if (m.find()) {
            return parse(m.group(1));
        }
        return Optional.empty();
    }

    private static Optional<Integer> parse(String digits) {
        try {
            return Optional.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Extensão em minúsculas, sem o ponto. */
    public static String extension(String name) {
        if (name == null) return "";
        int dot = name.lastIndexOf('.');
        return dot < 0 || dot == name.length() - 1 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
