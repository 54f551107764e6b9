package com.example.backupengine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupengine.config.AppConfig;
import com.example.backupengine.session.AuthRequiredException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

    @TempDir
    Path dataDir;

    private ByteArrayOutputStream buffer;
    private Main main;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.DATA_DIR, dataDir.toString(),
                AppConfig.APP_VERSION, "3.2.1"));
        main = new Main(config, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void usageWithoutArguments() throws Exception {
        assertEquals(2, main.run(new String[0]));
        assertTrue(output().contains("backup [local|drive]"));
    }

    @Test
    void unknownCommandPrintsUsage() throws Exception {
        assertEquals(2, main.run(new String[] {"sync"}));
        assertTrue(output().contains("Comando desconhecido: sync"));
    }

    @Test
    void localBackupThenRestore() throws Exception {
        Path chapter = dataDir.resolve("talevox/chapter_text/b1/001.txt");
        Files.createDirectories(chapter.getParent());
        Files.writeString(chapter, "texto");

        assertEquals(0, main.run(new String[] {"backup", "local"}));
        List<Path> backups;
        try (Stream<Path> files = Files.list(dataDir.resolve("talevox/backups"))) {
            backups = files.collect(Collectors.toList());
        }
        assertEquals(1, backups.size());
        assertTrue(output().contains("Backup salvo: " + backups.get(0).getFileName()));

        Files.delete(chapter);
        assertEquals(0, main.run(new String[] {"restore", backups.get(0).toString()}));
        assertEquals("texto", Files.readString(chapter));
        assertTrue(output().contains("1 arquivos"));
    }

    @Test
    void pruneLocalKeepsRequestedCount() throws Exception {
        Path dir = Files.createDirectories(dataDir.resolve("talevox/backups"));
        Files.write(dir.resolve("talevox-backup-2024-01-01-100000.zip"), new byte[] {1});
        Files.write(dir.resolve("talevox-backup-2024-01-02-100000.zip"), new byte[] {1});

        assertEquals(0, main.run(new String[] {"prune", "local", "1"}));
        assertTrue(output().contains("removidos: 1"));
    }

    @Test
    void driveCommandsRequireRootFolder() {
        assertThrows(IllegalStateException.class, () -> main.run(new String[] {"list-drive"}));
    }

    @Test
    void checkWithoutSessionIsAuthRequired() {
        assertThrows(AuthRequiredException.class, () -> main.run(new String[] {"check", "folder", "b1"}));
    }

    @Test
    void missingArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> main.run(new String[] {"restore"}));
    }
}
