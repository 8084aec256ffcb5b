package com.ryuqq.dealstore.adapter.file;

import com.ryuqq.dealstore.adapter.file.backup.BackupManager;
import com.ryuqq.dealstore.adapter.file.lock.BackoffCalculator;
import com.ryuqq.dealstore.adapter.file.lock.CommitLock;
import com.ryuqq.dealstore.adapter.file.mapping.DealTableMapper;
import com.ryuqq.dealstore.adapter.file.mapping.LookupTablesMapper;
import com.ryuqq.dealstore.adapter.file.schema.SchemaMigration;
import com.ryuqq.dealstore.adapter.file.schema.SchemaMigrator;
import com.ryuqq.dealstore.adapter.file.schema.WorkbookMetadata;
import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;
import com.ryuqq.dealstore.adapter.file.table.WorkbookCodec;
import com.ryuqq.dealstore.adapter.file.table.WorkbookFormatException;
import com.ryuqq.dealstore.adapter.file.validation.ValidationResult;
import com.ryuqq.dealstore.adapter.file.validation.WorkbookValidator;
import com.ryuqq.dealstore.core.context.SystemContext;
import com.ryuqq.dealstore.core.exception.IntegrityException;
import com.ryuqq.dealstore.core.exception.UnsupportedSchemaVersionException;
import com.ryuqq.dealstore.core.lookup.LookupTables;
import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealFilter;
import com.ryuqq.dealstore.core.normalize.DealNormalizer;
import com.ryuqq.dealstore.core.normalize.NormalizationResult;
import com.ryuqq.dealstore.core.spi.DealRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable {@link DealRepository} backed by a single JSON workbook file.
 *
 * <p>The file is loaded lazily on first access into an in-memory list. Mutations change only
 * that list and mark the repository dirty; {@link #saveChanges()} writes the list back
 * through the commit protocol.</p>
 *
 * <p><strong>Load:</strong></p>
 * <ol>
 *   <li>파일 없음 → 빈 저장소 (현재 스키마 버전)</li>
 *   <li>구조 검증, 실패 시 최신 백업으로 복원 후 재검증 (복원 불가 → {@link IntegrityException})</li>
 *   <li>지원하지 않는 버전 → {@link UnsupportedSchemaVersionException}, 아무 것도 로드하지 않음</li>
 *   <li>이전 버전 → migration chain 적용, dirty 표시</li>
 *   <li>모든 행을 normalize; 전체 읽기가 성공한 뒤에만 상태 교체</li>
 * </ol>
 *
 * <p><strong>Commit protocol:</strong></p>
 * <pre>
 * ReentrantLock (in-process)
 *   └─ CommitLock {file}.lock (cross-process, backoff retry)
 *        1. WRITE_TEMP      ~${file}.{id}.tmp, forced to disk
 *        2. VALIDATE_TEMP   same checks as load
 *        3. BACKUP          {base}_{yyyyMMdd_HHmmss}{ext}.bak
 *        4. REPLACE         ATOMIC_MOVE (plain replace if unsupported), then directory sync
 *        5. PRUNE_BACKUPS   keep maxBackups newest
 * </pre>
 *
 * <p>Any failure before step 4 leaves the durable file byte-identical and removes the temp
 * file. Readers of the file see either the old or the new content.</p>
 *
 * <p><strong>Thread Safety:</strong> every public method runs under one {@link ReentrantLock}.
 * Other processes sharing the file are serialized only at commit time; their unsaved changes
 * are not merged.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class FileDealRepository implements DealRepository {

    private static final Logger log = LoggerFactory.getLogger(FileDealRepository.class);

    private final Path file;
    private final SystemContext context;
    private final FileStoreConfig config;
    private final CommitInterceptor interceptor;

    private final WorkbookCodec codec = new WorkbookCodec();
    private final DealTableMapper dealMapper = new DealTableMapper();
    private final LookupTablesMapper lookupsMapper = new LookupTablesMapper();
    private final SchemaMigrator migrator;
    private final WorkbookValidator validator;
    private final BackupManager backups;
    private final BackoffCalculator backoff;

    private final ReentrantLock lock = new ReentrantLock();

    private List<Deal> deals;
    private LookupTables lookups;
    private DealNormalizer normalizer;
    private String loadedSchemaVersion;
    private boolean dirty;

    public FileDealRepository(Path file) {
        this(file, SystemContext.system(), new FileStoreConfig());
    }

    public FileDealRepository(Path file, SystemContext context, FileStoreConfig config) {
        this(file, context, config, CommitInterceptor.NONE);
    }

    /**
     * @param file durable file (created on first commit)
     * @param context clock and id generator for normalization, metadata and backup names
     * @param config store settings
     * @param interceptor commit step hook
     */
    public FileDealRepository(Path file, SystemContext context, FileStoreConfig config,
                              CommitInterceptor interceptor) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (interceptor == null) {
            throw new IllegalArgumentException("interceptor cannot be null");
        }
        this.file = file;
        this.context = context;
        this.config = config;
        this.interceptor = interceptor;
        this.migrator = SchemaMigrator.standard(config.currentSchemaVersion(), config.supportedSchemaVersions());
        this.validator = new WorkbookValidator(codec, migrator);
        this.backups = new BackupManager(file, context);
        this.backoff = new BackoffCalculator(config.lockBaseDelayMs(), config.lockMaxDelayMs(),
            config.lockJitterFactor());
    }

    // ========================================
    // DealRepository
    // ========================================

    @Override
    public List<Deal> getAll() {
        lock.lock();
        try {
            ensureLoaded();
            List<Deal> copies = new ArrayList<>(deals.size());
            for (Deal deal : deals) {
                copies.add(deal.copy());
            }
            return copies;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Deal> getById(String dealId) {
        if (dealId == null) {
            throw new IllegalArgumentException("dealId cannot be null");
        }
        lock.lock();
        try {
            ensureLoaded();
            int index = indexOf(deals, dealId);
            return index < 0 ? Optional.empty() : Optional.of(deals.get(index).copy());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Deal> query(DealFilter filter, LocalDate referenceDate) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (referenceDate == null) {
            throw new IllegalArgumentException("referenceDate cannot be null");
        }
        lock.lock();
        try {
            ensureLoaded();
            List<Deal> matches = new ArrayList<>();
            for (Deal deal : deals) {
                if (filter.matches(deal, referenceDate)) {
                    matches.add(deal.copy());
                }
            }
            return matches;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void upsert(Deal deal) {
        requireKeyed(deal);
        lock.lock();
        try {
            ensureLoaded();
            upsertInto(deals, deal.copy());
            dirty = true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void upsertMany(Collection<Deal> batch) {
        if (batch == null) {
            throw new IllegalArgumentException("deals cannot be null");
        }
        for (Deal deal : batch) {
            requireKeyed(deal);
        }
        lock.lock();
        try {
            ensureLoaded();
            for (Deal deal : batch) {
                upsertInto(deals, deal.copy());
            }
            dirty = true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String dealId) {
        if (dealId == null) {
            throw new IllegalArgumentException("dealId cannot be null");
        }
        lock.lock();
        try {
            ensureLoaded();
            int index = indexOf(deals, dealId);
            if (index >= 0) {
                deals.remove(index);
                dirty = true;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Commits pending changes. No-op when nothing changed and the file already exists.
     *
     * @throws com.ryuqq.dealstore.core.exception.LockTimeoutException if another process holds the lock too long
     * @throws IntegrityException if the written temp file fails validation
     * @throws UncheckedIOException on I/O failure
     */
    @Override
    public void saveChanges() {
        lock.lock();
        try {
            ensureLoaded();
            if (!dirty && Files.exists(file)) {
                log.debug("No pending changes for {}", file);
                return;
            }
            commit();
            dirty = false;
            loadedSchemaVersion = config.currentSchemaVersion();
        } finally {
            lock.unlock();
        }
    }

    // ========================================
    // Store management
    // ========================================

    /**
     * Loads (or re-loads) the durable file, replacing the in-memory state.
     *
     * @throws IntegrityException if neither the file nor its newest backup is valid
     * @throws UnsupportedSchemaVersionException if the file has an unknown schema version
     */
    public void load() {
        lock.lock();
        try {
            doLoad();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards unsaved changes and reads the durable file again.
     */
    public void reload() {
        load();
    }

    /**
     * Checks the durable file without loading it.
     */
    public ValidationResult validate() {
        return validator.validate(file);
    }

    /**
     * Copies the newest backup over the durable file and reloads it.
     *
     * @return the backup used, or empty if there is none (state unchanged)
     */
    public Optional<Path> restoreFromBackup() {
        lock.lock();
        try {
            Optional<Path> restored = backups.restoreLatest();
            if (restored.isPresent()) {
                doLoad();
            }
            return restored;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Backups of the durable file, newest first.
     */
    public List<Path> backups() {
        return backups.list();
    }

    /**
     * Reads the Lookups table of the durable file over the defaults.
     *
     * <p>The file is validated first, as on load. This method never modifies the file, so an
     * invalid file is reported rather than restored from a backup.</p>
     *
     * @return lookup tables; the defaults when the file or its Lookups table is missing
     * @throws UnsupportedSchemaVersionException if the file has an unknown schema version
     * @throws IntegrityException if the file fails validation
     */
    public LookupTables importLookups() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return LookupTables.createDefault();
            }
            ValidationResult result = validator.validate(file);
            rejectUnsupported(result);
            if (!result.valid()) {
                throw new IntegrityException("Durable file " + file + " is invalid, lookups not imported",
                    result.errors());
            }
            return lookupsMapper.fromTable(readWorkbook().table(Workbook.LOOKUPS));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Normalizer bound to the lookups of the loaded file and this repository's context.
     */
    public DealNormalizer normalizer() {
        lock.lock();
        try {
            ensureLoaded();
            return normalizer;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Schema version detected on disk at load time, or the current version after a commit.
     */
    public String loadedSchemaVersion() {
        lock.lock();
        try {
            ensureLoaded();
            return loadedSchemaVersion;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDirty() {
        lock.lock();
        try {
            return dirty;
        } finally {
            lock.unlock();
        }
    }

    public Path filePath() {
        return file;
    }

    public FileStoreConfig config() {
        return config;
    }

    // ========================================
    // Load
    // ========================================

    private void ensureLoaded() {
        if (deals == null) {
            doLoad();
        }
    }

    private void doLoad() {
        if (!Files.exists(file)) {
            log.info("Durable file {} does not exist, starting empty", file);
            LookupTables defaults = LookupTables.createDefault();
            assign(new ArrayList<>(), defaults, config.currentSchemaVersion(), false);
            return;
        }

        ValidationResult result = checkedValidation();
        Workbook workbook = readWorkbook();
        List<SchemaMigration> applied = migrator.migrate(workbook, result.schemaVersion());
        if (!applied.isEmpty()) {
            log.info("Migrated {} from schema {} to {} in memory", file, result.schemaVersion(),
                config.currentSchemaVersion());
        }

        LookupTables fileLookups = lookupsMapper.fromTable(workbook.table(Workbook.LOOKUPS));
        DealNormalizer loadNormalizer = new DealNormalizer(fileLookups, context);
        Table dealsTable = workbook.table(Workbook.DEALS)
            .orElseThrow(() -> new IntegrityException("Deals table disappeared after validation", List.of()));

        List<Deal> loaded = new ArrayList<>();
        boolean normalizedOnLoad = false;
        for (Deal raw : dealMapper.fromTable(dealsTable)) {
            NormalizationResult normalized = loadNormalizer.normalizeWithTracking(raw);
            normalizedOnLoad |= normalized.hasChanges();
            upsertInto(loaded, normalized.deal());
        }

        boolean pending = !applied.isEmpty() || normalizedOnLoad;
        assign(loaded, fileLookups, result.schemaVersion(), pending);
        log.info("Loaded {} deal(s) from {} (schema {}{})", loaded.size(), file, result.schemaVersion(),
            pending ? ", pending rewrite" : "");
    }

    /**
     * Validates the durable file, falling back to the newest backup once.
     */
    private ValidationResult checkedValidation() {
        ValidationResult result = validator.validate(file);
        rejectUnsupported(result);
        if (result.valid()) {
            logWarnings(result);
            return result;
        }

        log.warn("Durable file {} failed validation: {}", file, result.errors());
        Optional<Path> restored = backups.restoreLatest();
        if (restored.isEmpty()) {
            throw new IntegrityException("Durable file " + file + " is invalid and no backup is available",
                result.errors());
        }

        ValidationResult retry = validator.validate(file);
        rejectUnsupported(retry);
        if (!retry.valid()) {
            throw new IntegrityException("Durable file " + file + " is invalid after restoring backup "
                + restored.get().getFileName(), retry.errors());
        }
        logWarnings(retry);
        return retry;
    }

    private void rejectUnsupported(ValidationResult result) {
        if (result.schemaVersion() != null && !result.supportedVersion()) {
            throw new UnsupportedSchemaVersionException(result.schemaVersion(), config.supportedSchemaVersions());
        }
    }

    private void logWarnings(ValidationResult result) {
        for (String warning : result.warnings()) {
            log.warn("{}: {}", file, warning);
        }
    }

    private Workbook readWorkbook() {
        try {
            return codec.read(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        } catch (WorkbookFormatException e) {
            throw new IntegrityException("Durable file " + file + " cannot be decoded", e);
        }
    }

    private void assign(List<Deal> newDeals, LookupTables newLookups, String version, boolean pending) {
        this.deals = newDeals;
        this.lookups = newLookups;
        this.normalizer = new DealNormalizer(newLookups, context);
        this.loadedSchemaVersion = version;
        this.dirty = pending;
    }

    // ========================================
    // Commit
    // ========================================

    private void commit() {
        createParentDirectories();
        Path temp = file.resolveSibling("~$" + file.getFileName() + "."
            + UUID.randomUUID().toString().substring(0, 8) + ".tmp");

        try (CommitLock commitLock = CommitLock.acquire(file, config.lockMaxAttempts(), backoff)) {
            try {
                interceptor.beforeStep(CommitStep.LOCK_ACQUIRED, file, temp);

                interceptor.beforeStep(CommitStep.WRITE_TEMP, file, temp);
                codec.write(buildWorkbook(), temp);

                interceptor.beforeStep(CommitStep.VALIDATE_TEMP, file, temp);
                ValidationResult result = validator.validate(temp);
                if (!result.valid()) {
                    throw new IntegrityException("Commit aborted: written file failed validation", result.errors());
                }

                interceptor.beforeStep(CommitStep.BACKUP, file, temp);
                backups.create();

                interceptor.beforeStep(CommitStep.REPLACE, file, temp);
                replace(temp);
            } catch (IOException e) {
                throw new UncheckedIOException("Commit failed for " + file, e);
            } finally {
                deleteTemp(temp);
            }

            interceptor.beforeStep(CommitStep.PRUNE_BACKUPS, file, temp);
            pruneBackups();
            log.info("Committed {} deal(s) to {} under {}", deals.size(), file, commitLock.markerPath());
        }
    }

    private Workbook buildWorkbook() {
        Workbook workbook = new Workbook();
        workbook.putTable(dealMapper.toTable(deals));
        workbook.putTable(lookupsMapper.toTable(lookups));
        workbook.putTable(WorkbookMetadata.create(config.currentSchemaVersion(), context.now(), deals.size()));
        return workbook;
    }

    private void replace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace: {}", file, e.getMessage());
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        syncDirectory(file.toAbsolutePath().getParent());
    }

    /**
     * Forces a directory entry change (the rename above) to the storage device.
     *
     * <p>Windows cannot open a directory as a channel; there the call does nothing.</p>
     */
    static void syncDirectory(Path dir) throws IOException {
        if (dir == null || System.getProperty("os.name", "").toLowerCase().contains("win")) {
            return;
        }
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        }
    }

    private void pruneBackups() {
        try {
            backups.prune(config.maxBackups());
        } catch (UncheckedIOException e) {
            // commit already replaced the file; stale backups are removed on the next commit
            log.warn("Backup pruning failed for {}", file, e);
        }
    }

    private void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}", temp, e);
        }
    }

    private void createParentDirectories() {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + parent, e);
        }
    }

    // ========================================
    // Helpers
    // ========================================

    private static void requireKeyed(Deal deal) {
        if (deal == null) {
            throw new IllegalArgumentException("deal cannot be null");
        }
        if (deal.getDealId().isBlank()) {
            throw new IllegalArgumentException("dealId cannot be blank");
        }
    }

    private static void upsertInto(List<Deal> target, Deal deal) {
        int index = indexOf(target, deal.getDealId());
        if (index >= 0) {
            target.set(index, deal);
        } else {
            target.add(deal);
        }
    }

    private static int indexOf(List<Deal> target, String dealId) {
        for (int i = 0; i < target.size(); i++) {
            if (target.get(i).getDealId().equalsIgnoreCase(dealId)) {
                return i;
            }
        }
        return -1;
    }
}
