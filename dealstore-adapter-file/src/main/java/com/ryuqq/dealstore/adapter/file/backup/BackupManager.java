package com.ryuqq.dealstore.adapter.file.backup;

import com.ryuqq.dealstore.core.context.SystemContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Timestamped copies of the durable file.
 *
 * <p><strong>Naming:</strong> {@code pipeline.json} → {@code pipeline_20250315_143000.json.bak},
 * timestamp taken from the context clock in UTC. The timestamp format sorts lexically, so the
 * newest backup has the greatest name.</p>
 *
 * <p>Only names of exactly that shape belong to the file. A sibling store such as
 * {@code pipeline_archive.json} has backups that also start with {@code pipeline_}, and those
 * are never listed, pruned or restored here.</p>
 *
 * <p>Two backups in the same second overwrite each other; the later copy wins.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
        .withZone(ZoneOffset.UTC);
    static final String SUFFIX = ".bak";

    private final Path file;
    private final SystemContext context;
    private final String baseName;
    private final String extension;
    private final Pattern backupName;

    public BackupManager(Path file, SystemContext context) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.file = file;
        this.context = context;
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        this.baseName = dot > 0 ? name.substring(0, dot) : name;
        this.extension = dot > 0 ? name.substring(dot) : "";
        this.backupName = Pattern.compile(
            Pattern.quote(baseName + "_") + "\\d{8}_\\d{6}" + Pattern.quote(extension + SUFFIX));
    }

    /**
     * Copies the current durable file to a new backup.
     *
     * @return backup path, or empty if the durable file does not exist
     * @throws UncheckedIOException if the copy fails
     */
    public Optional<Path> create() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        Path backup = file.resolveSibling(baseName + "_" + TIMESTAMP.format(context.now()) + extension + SUFFIX);
        try {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to back up " + file + " to " + backup, e);
        }
        log.debug("Created backup {}", backup);
        return Optional.of(backup);
    }

    /**
     * Backups of this file, newest first.
     */
    public List<Path> list() {
        Path dir = directory();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> backups = new ArrayList<>();
        String glob = globEscape(baseName) + "_*" + globEscape(extension) + SUFFIX;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path path : stream) {
                if (isBackup(path)) {
                    backups.add(path);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list backups in " + dir, e);
        }
        backups.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
        return backups;
    }

    /**
     * Deletes all but the {@code keep} newest backups.
     *
     * @param keep number of backups to retain (0 이상)
     * @return deleted backups
     */
    public List<Path> prune(int keep) {
        if (keep < 0) {
            throw new IllegalArgumentException("keep must be >= 0 (current: " + keep + ")");
        }
        List<Path> backups = list();
        List<Path> deleted = new ArrayList<>();
        for (int i = keep; i < backups.size(); i++) {
            Path old = backups.get(i);
            try {
                Files.deleteIfExists(old);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete backup " + old, e);
            }
            deleted.add(old);
        }
        if (!deleted.isEmpty()) {
            log.debug("Pruned {} backup(s) of {}", deleted.size(), file);
        }
        return deleted;
    }

    /**
     * Copies the newest backup over the durable file.
     *
     * @return the restored backup, or empty if there is none
     */
    public Optional<Path> restoreLatest() {
        List<Path> backups = list();
        if (backups.isEmpty()) {
            return Optional.empty();
        }
        Path latest = backups.get(0);
        try {
            Files.copy(latest, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to restore " + file + " from " + latest, e);
        }
        log.info("Restored {} from backup {}", file, latest);
        return Optional.of(latest);
    }

    /**
     * Whether the path is named like a backup of this file.
     */
    public boolean isBackup(Path path) {
        return path != null
            && path.getFileName() != null
            && backupName.matcher(path.getFileName().toString()).matches();
    }

    private Path directory() {
        Path parent = file.toAbsolutePath().getParent();
        return parent == null ? file.toAbsolutePath().getRoot() : parent;
    }

    private static String globEscape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if ("*?[]{}\\".indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
