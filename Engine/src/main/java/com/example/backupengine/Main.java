package com.example.backupengine;

import com.example.backupengine.archive.Archive;
import com.example.backupengine.archive.Archive.BackupOptions;
import com.example.backupengine.archive.Archive.Platform;
import com.example.backupengine.backup.Backup.BackupCoordinator;
import com.example.backupengine.backup.Backup.BackupSettings;
import com.example.backupengine.backup.Backup.SaveResult;
import com.example.backupengine.backup.Backup.StoreContextProvider;
import com.example.backupengine.config.AppConfig;
import com.example.backupengine.db.Database.JsonDocumentStore;
import com.example.backupengine.drive.DriveFolderAdapter;
import com.example.backupengine.drive.DriveGateway;
import com.example.backupengine.folders.FolderManifests.BookFolderManifests;
import com.example.backupengine.folders.FolderManifests.FolderManifestInitializer;
import com.example.backupengine.library.Library.Book;
import com.example.backupengine.library.Snapshots.DefaultSnapshotBuilder;
import com.example.backupengine.packager.PackagerModule.ArchivePackager;
import com.example.backupengine.prefs.Preferences.FilePreferenceStore;
import com.example.backupengine.progress.Progress.ProgressListener;
import com.example.backupengine.reconcile.Reconciler.RemoteReconciler;
import com.example.backupengine.reconcile.Reconciler.ScanResult;
import com.example.backupengine.restore.Restore.RestoreOrchestrator;
import com.example.backupengine.restore.Restore.RestoreResult;
import com.example.backupengine.retention.Retention.PruneResult;
import com.example.backupengine.session.AuthRequiredException;
import com.example.backupengine.session.SessionManager;
import com.example.backupengine.session.SessionManager.StaticTokenSource;
import com.example.backupengine.storage.Storage.BackupTarget;
import com.example.backupengine.storage.Storage.LocalFileSystem;
import com.example.backupengine.storage.Storage.RemoteFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entrada headless do motor de backup. Um comando por execução.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = String.join(System.lineSeparator(),
            "Uso:",
            "  backup [local|drive]",
            "  restore <arquivo.zip>",
            "  restore-drive <fileId>",
            "  list-drive",
            "  prune [local|drive] <manter>",
            "  check <bookFolderId> <bookId>",
            "  init-folders <bookFolderId> <bookId>");

    private final AppConfig config;
    private final PrintStream out;

    public Main(AppConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        int code;
        try {
            code = new Main(AppConfig.load(), System.out).run(args);
        } catch (AuthRequiredException e) {
            log.error("{}: {}", e.code(), e.getMessage());
            code = 3;
        } catch (IOException | RuntimeException e) {
            log.error("Falha: {}", e.getMessage(), e);
            code = 1;
        }
        System.exit(code);
    }

    /** @return código de saída */
    public int run(String[] args) throws IOException {
        if (args.length == 0) {
            out.println(USAGE);
            return 2;
        }
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);

        ObjectMapper mapper = Archive.newMapper();
        Path dataDir = config.dataDir();
        Platform platform = config.platform();
        LocalFileSystem fileSystem = new LocalFileSystem(dataDir);
        FilePreferenceStore prefs = new FilePreferenceStore(dataDir.resolve("prefs.json"), mapper);
        JsonDocumentStore db = new JsonDocumentStore(dataDir.resolve("library.json"), mapper);
        SessionManager session = new SessionManager(new StaticTokenSource(config.driveAccessToken().orElse(null)));
        DriveGateway drive = new DriveGateway(config, session);
        String rootFolderId = config.driveRootFolderId().orElse(null);
        log.debug("Configuração: {}", config);

        switch (command) {
            case "check":
                requireArgs(rest, 2);
                return check(new RemoteReconciler(session, drive), db, rest.get(0), rest.get(1));
            case "init-folders":
                requireArgs(rest, 2);
                return initFolders(new FolderManifestInitializer(db, mapper), new DriveFolderAdapter(drive), db,
                        rest.get(0), rest.get(1));
            default:
                break;
        }

        ArchivePackager packager = ArchivePackager.builder()
                .platform(platform)
                .appVersion(config.appVersion())
                .snapshotBuilder(new DefaultSnapshotBuilder(config.appVersion()))
                .preferences(prefs)
                .storageDriver(db)
                .nativeExport(db)
                .fileSystem(fileSystem)
                .mapper(mapper)
                .largeFileThreshold(config.largeFileWarningBytes())
                .zone(config.backupZone())
                .build();
        RestoreOrchestrator restorer = RestoreOrchestrator.builder()
                .platform(platform)
                .library(db)
                .storageDriver(db)
                .nativeExport(db)
                .preferences(prefs)
                .fileSystem(fileSystem)
                .mapper(mapper)
                .listener(result -> log.info("Estado restaurado; o app deve recarregar ({} livros)", result.booksRestored()))
                .build();
        ProgressListener progress = event -> log.info("[{}] {}", event.step().wireName(), event.message());

        try (BackupCoordinator coordinator = BackupCoordinator.builder()
                .packager(packager)
                .restorer(restorer)
                .contextProvider(new StoreContextProvider(db, db, prefs, mapper))
                .preferences(prefs)
                .fileSystem(fileSystem)
                .remote(drive, rootFolderId)
                .defaultSettings(BackupSettings.defaults(config))
                .workDir(dataDir.resolve(".work"))
                .mapper(mapper)
                .build()) {

            switch (command) {
                case "backup": {
                    BackupTarget target = rest.isEmpty() ? BackupTarget.LOCAL : BackupTarget.fromWire(rest.get(0));
                    Optional<SaveResult> saved = coordinator.backupNow(target, BackupOptions.defaults(), progress);
                    if (saved.isEmpty()) {
                        out.println("Outra operação de backup está em andamento.");
                        return 1;
                    }
                    SaveResult r = saved.get();
                    out.println("Backup salvo: " + r.fileName() + " -> " + r.location() + " (" + r.sizeBytes() + " bytes)");
                    r.meta().warnings().forEach(w -> out.println("  aviso: " + w));
                    r.retention().ifPresent(p -> out.println("  retenção: " + p.deleted().size() + " removidos"));
                    return 0;
                }
                case "restore": {
                    requireArgs(rest, 1);
                    return printRestore(coordinator.restoreFromFile(Path.of(rest.get(0)), progress));
                }
                case "restore-drive": {
                    requireArgs(rest, 1);
                    return printRestore(coordinator.restoreFromDrive(rest.get(0), progress));
                }
                case "list-drive": {
                    List<RemoteFile> backups = coordinator.listDriveBackups();
                    for (RemoteFile f : backups) {
                        out.println(f.id() + "\t" + f.name() + "\t" + f.size() + "\t"
                                + f.modifiedTime().map(Object::toString).orElse("-"));
                    }
                    out.println(backups.size() + " backups no Drive");
                    return 0;
                }
                case "prune": {
                    requireArgs(rest, 2);
                    PruneResult p = coordinator.prune(BackupTarget.fromWire(rest.get(0)), Integer.parseInt(rest.get(1)));
                    out.println("Mantidos: " + p.kept().size() + ", removidos: " + p.deleted().size()
                            + ", falhas: " + p.failed().size());
                    return 0;
                }
                default:
                    out.println("Comando desconhecido: " + command);
                    out.println(USAGE);
                    return 2;
            }
        }
    }

    private int printRestore(Optional<RestoreResult> restored) {
        if (restored.isEmpty()) {
            out.println("Outra operação de backup está em andamento.");
            return 1;
        }
        RestoreResult r = restored.get();
        out.println("Restaurado: " + r.booksRestored() + " livros, " + r.chaptersRestored() + " capítulos, "
                + r.filesRestored() + " arquivos" + (r.usedSnapshotFallback() ? " (via snapshot)" : ""));
        r.warnings().forEach(w -> out.println("  aviso: " + w));
        return 0;
    }

    private int check(RemoteReconciler reconciler, JsonDocumentStore db, String folderId, String bookId)
            throws IOException {
        ScanResult scan = reconciler.scan(folderId, db.listChapters(bookId));
        if (!scan.updatedChapters().isEmpty()) {
            db.bulkUpsertChapters(bookId, scan.updatedChapters());
        }
        out.println(scan.message());
        if (!scan.listingAvailable()) {
            out.println("  listagem do Drive indisponível; nada foi alterado");
        }
        scan.strayFiles().forEach(f -> out.println("  solto: " + f.name() + " (" + f.id() + ")"));
        scan.duplicates().forEach(f -> out.println("  duplicado: " + f.name() + " (" + f.id() + ")"));
        out.println("  sem texto: " + scan.missingTextIds().size() + ", atualizados: " + scan.updatedChapters().size());
        return 0;
    }

    private int initFolders(FolderManifestInitializer initializer, DriveFolderAdapter adapter, JsonDocumentStore db,
                            String folderId, String bookId) throws IOException {
        Optional<Book> book = db.listBooks().stream().filter(b -> bookId.equals(b.id)).findFirst();
        if (book.isEmpty()) {
            out.println("Livro não encontrado: " + bookId);
            return 1;
        }
        BookFolderManifests manifests = initializer.ensure(adapter, DriveFolderAdapter.root(folderId), book.get());
        out.println("book.json " + (manifests.bookCreated() ? "criado" : "existente")
                + ", inventory.json " + (manifests.inventoryCreated() ? "criado" : "existente")
                + " (" + manifests.inventory().chapters.size() + " capítulos)");
        return 0;
    }

    private static void requireArgs(List<String> args, int count) {
        if (args.size() < count) {
            throw new IllegalArgumentException("Argumentos insuficientes." + System.lineSeparator() + USAGE);
        }
    }
}
