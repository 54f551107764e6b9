package com.example.backupengine.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupengine.reconcile.ChapterFileNames.ContentClass;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChapterFileNamesTest {

    @Test
    void buildsZeroPaddedNames() {
        assertEquals("007_O Fim.txt", ChapterFileNames.buildTextName(7, "O Fim"));
        assertEquals("123_Batalha.mp3", ChapterFileNames.buildAudioName(123, "Batalha"));
    }

    @Test
    void sanitizesIllegalCharactersAndBlankTitles() {
        assertEquals("001_a_b_c.txt", ChapterFileNames.buildTextName(1, "a/b:c"));
        assertEquals("002_Chapter.txt", ChapterFileNames.buildTextName(2, "   "));
        assertEquals("003_Chapter.mp3", ChapterFileNames.buildAudioName(3, null));
    }

    @Test
    void truncatesLongTitles() {
        String title = "x".repeat(200);
        String name = ChapterFileNames.buildTextName(1, title);
        assertEquals(4 + ChapterFileNames.MAX_TITLE_LENGTH + 4, name.length());
    }

    @Test
    void infersIndexFromLeadingDigits() {
        assertEquals(Optional.of(7), ChapterFileNames.inferIndexFromName("007_O Fim.txt"));
        assertEquals(Optional.of(12), ChapterFileNames.inferIndexFromName("12 - Retorno.mp3"));
    }

    @Test
    void infersIndexFromChapterMarker() {
        assertEquals(Optional.of(1), ChapterFileNames.inferIndexFromName("Chapter 1.txt"));
        assertEquals(Optional.of(3), ChapterFileNames.inferIndexFromName("cap-03.mp3"));
        assertEquals(Optional.of(99), ChapterFileNames.inferIndexFromName("Chapter 99.txt"));
    }

    @Test
    void noIndexForUnnumberedNames() {
        assertTrue(ChapterFileNames.inferIndexFromName("cover.jpg").isEmpty());
        assertTrue(ChapterFileNames.inferIndexFromName("notes.txt").isEmpty());
        assertTrue(ChapterFileNames.inferIndexFromName("").isEmpty());
        assertTrue(ChapterFileNames.inferIndexFromName(null).isEmpty());
    }

    @Test
    void classifiesByExtension() {
        assertEquals(ContentClass.TEXT, ContentClass.ofName("a.TXT"));
        assertEquals(ContentClass.TEXT, ContentClass.ofName("a.md"));
        assertEquals(ContentClass.AUDIO, ContentClass.ofName("a.m4a"));
        assertEquals(ContentClass.OTHER, ContentClass.ofName("a.jpg"));
        assertEquals(ContentClass.OTHER, ContentClass.ofName("semextensao"));
    }
}
