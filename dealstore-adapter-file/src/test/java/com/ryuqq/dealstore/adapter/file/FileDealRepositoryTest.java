package com.ryuqq.dealstore.adapter.file;

import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;
import com.ryuqq.dealstore.adapter.file.table.WorkbookCodec;
import com.ryuqq.dealstore.core.context.SystemContext;
import com.ryuqq.dealstore.core.exception.IntegrityException;
import com.ryuqq.dealstore.core.exception.UnsupportedSchemaVersionException;
import com.ryuqq.dealstore.core.lookup.LookupTables;
import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.core.model.DealStage;
import com.ryuqq.dealstore.testkit.fixture.DealFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileDealRepository 로드/저장 동작 테스트.
 *
 * <p>Contract suite 밖의 동작: lazy load, 로드 시 normalize, dirty 추적, reload, lookups.</p>
 */
class FileDealRepositoryTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 15);

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("pipeline.json");
    }

    private FileDealRepository open() {
        return new FileDealRepository(file, SystemContext.forTesting(TODAY), new FileStoreConfig());
    }

    // ============================================================
    // 파일 없음
    // ============================================================

    @Test
    @DisplayName("파일이 없으면 빈 저장소, 현재 스키마 버전, clean 상태")
    void absentFile_startsEmpty() {
        FileDealRepository repository = open();

        assertThat(repository.getAll()).isEmpty();
        assertThat(repository.loadedSchemaVersion()).isEqualTo("1.2");
        assertThat(repository.isDirty()).isFalse();
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    void firstSave_createsFileWithCurrentMetadata() throws Exception {
        FileDealRepository repository = open();
        repository.upsertMany(DealFixtures.deals(2));

        repository.saveChanges();

        Workbook written = new WorkbookCodec().read(file);
        Table metadata = written.table(Workbook.METADATA).orElseThrow();
        assertThat(metadata.rows()).contains(
            List.of("Version", "1.2"),
            List.of("LastModified", "2025-03-15T00:00:00Z"),
            List.of("DealCount", "2"),
            List.of("GeneratedBy", "DealStore Sales Pipeline Manager"));
        assertThat(written.hasTable(Workbook.LOOKUPS)).isTrue();
        assertThat(repository.isDirty()).isFalse();
    }

    @Test
    void saveChanges_createsMissingParentDirectories() {
        file = tempDir.resolve("nested/dir/pipeline.json");
        FileDealRepository repository = open();
        repository.upsert(DealFixtures.deal("D-001"));

        repository.saveChanges();

        assertThat(Files.exists(file)).isTrue();
    }

    // ============================================================
    // Dirty 추적
    // ============================================================

    @Test
    void cleanRepository_doesNotRewriteFile() throws Exception {
        FileDealRepository repository = open();
        repository.upsert(DealFixtures.deal("D-001"));
        repository.saveChanges();
        long modified = Files.getLastModifiedTime(file).toMillis();
        byte[] before = Files.readAllBytes(file);

        repository.saveChanges();

        assertThat(Files.readAllBytes(file)).isEqualTo(before);
        assertThat(Files.getLastModifiedTime(file).toMillis()).isEqualTo(modified);
        assertThat(repository.backups()).isEmpty();
    }

    @Test
    void deleteOfMissingId_doesNotMarkDirty() {
        FileDealRepository repository = open();
        repository.upsert(DealFixtures.deal("D-001"));
        repository.saveChanges();

        repository.delete("D-404");

        assertThat(repository.isDirty()).isFalse();
    }

    @Test
    @DisplayName("정규화된 파일을 다시 읽으면 변경 없음 (clean)")
    void reopeningNormalizedFile_isClean() {
        FileDealRepository repository = open();
        repository.upsert(DealFixtures.fullyPopulated("D-FULL"));
        repository.saveChanges();

        FileDealRepository reopened = open();

        assertThat(reopened.getAll()).hasSize(1);
        assertThat(reopened.isDirty()).isFalse();
    }

    @Test
    @DisplayName("문자 없는 우편번호도 다시 읽으면 clean, 백업이 늘지 않음")
    void postcodeWithoutLetters_reopensClean() throws Exception {
        FileDealRepository repository = open();
        Deal deal = Deal.of("D-NUM", "Acme", "Heat pump");
        deal.setPostcode("123");
        repository.upsert(repository.normalizer().normalize(deal));
        repository.saveChanges();
        byte[] written = Files.readAllBytes(file);

        FileDealRepository reopened = open();
        reopened.saveChanges();

        assertThat(reopened.getById("D-NUM")).hasValueSatisfying(
            d -> assertThat(d.getPostcodeArea()).isNull());
        assertThat(reopened.isDirty()).isFalse();
        assertThat(Files.readAllBytes(file)).isEqualTo(written);
        assertThat(reopened.backups()).isEmpty();
    }

    @Test
    void reload_discardsUnsavedChanges() {
        FileDealRepository repository = open();
        repository.upsert(DealFixtures.deal("D-001"));
        repository.saveChanges();
        repository.upsert(DealFixtures.deal("D-002"));
        repository.delete("D-001");

        repository.reload();

        assertThat(repository.getAll()).extracting(Deal::getDealId).containsExactly("D-001");
        assertThat(repository.isDirty()).isFalse();
    }

    // ============================================================
    // 로드 시 normalize
    // ============================================================

    @Test
    @DisplayName("로드 시 모든 행을 normalize하고 헤더 별칭을 인식")
    void load_normalizesRowsAndAcceptsAliases() throws Exception {
        Workbook workbook = new Workbook();
        Table deals = workbook.addTable(Workbook.DEALS);
        deals.addRow("ID", "Company", "Deal Name", "stage", "Zip", "Amount", "Notes");
        deals.addRow("", "Acme", "Roof array", "proposal", "sw1a 1aa", "£12,000", "call back");
        deals.addRow("", "", "", "", "", "", "");
        deals.addRow("D-7", "", "", "won", "", "", "");
        TestWorkbooks.write(workbook, file);

        FileDealRepository repository = open();
        List<Deal> loaded = repository.getAll();

        assertThat(loaded).hasSize(2);
        Deal first = loaded.get(0);
        assertThat(first.getDealId()).isEqualTo("D-20250315-00000001");
        assertThat(first.getAccountName()).isEqualTo("Acme");
        assertThat(first.getStage()).isEqualTo(DealStage.PROPOSAL);
        assertThat(first.getProbability()).isEqualTo(60);
        assertThat(first.getPostcodeArea()).isEqualTo("SW");
        assertThat(first.getRegion()).isEqualTo("London");
        assertThat(first.getAmountGbp()).isEqualByComparingTo("12000");
        assertThat(first.getComments()).isEqualTo("call back");
        assertThat(first.getCreatedDate()).isEqualTo(TODAY);

        Deal second = loaded.get(1);
        assertThat(second.getAccountName()).isEqualTo("Unknown");
        assertThat(second.getDealName()).isEqualTo("Unnamed Deal");
        assertThat(second.getStage()).isEqualTo(DealStage.CLOSED_WON);

        assertThat(repository.isDirty())
            .as("generated ids must be persisted on the next commit")
            .isTrue();
    }

    @Test
    void generatedIds_surviveSaveAndReopen() throws Exception {
        Workbook workbook = TestWorkbooks.withVersion("1.2", TestWorkbooks.row("", "Acme", "Roof", "Lead"));
        TestWorkbooks.write(workbook, file);
        FileDealRepository repository = open();
        String generated = repository.getAll().get(0).getDealId();

        repository.saveChanges();

        assertThat(open().getById(generated)).isPresent();
    }

    // ============================================================
    // Lookups
    // ============================================================

    @Test
    void importLookups_readsFileOverDefaults() throws Exception {
        TestWorkbooks.write(TestWorkbooks.v11(), file);

        LookupTables lookups = open().importLookups();

        assertThat(lookups.probabilityForStage(DealStage.PROPOSAL)).isEqualTo(55);
        assertThat(lookups.probabilityForStage(DealStage.NEGOTIATION)).isEqualTo(80);
        assertThat(lookups.regionForArea("SW")).isEqualTo("London");
        assertThat(lookups.regionForArea("EH")).isEqualTo("Scotland");
    }

    @Test
    void importLookups_rejectsUnsupportedSchemaVersion() throws Exception {
        TestWorkbooks.write(TestWorkbooks.withVersion("9.9"), file);

        assertThatThrownBy(() -> open().importLookups())
            .isInstanceOfSatisfying(UnsupportedSchemaVersionException.class,
                e -> assertThat(e.getVersion()).isEqualTo("9.9"));
    }

    @Test
    @DisplayName("구조가 잘못된 파일은 lookups를 읽지 않고 파일도 건드리지 않음")
    void importLookups_rejectsInvalidFileWithoutRestoring() throws Exception {
        Workbook broken = TestWorkbooks.v11();
        broken.putTable(new Table(Workbook.DEALS).addRow("DealId", "Stage"));
        TestWorkbooks.write(broken, file);
        byte[] before = Files.readAllBytes(file);
        Files.write(tempDir.resolve("pipeline_20250101_000000.json.bak"), before);

        assertThatThrownBy(() -> open().importLookups())
            .isInstanceOfSatisfying(IntegrityException.class,
                e -> assertThat(e.getErrors()).contains("Missing required column: AccountName"))
            .hasMessageContaining("lookups not imported");
        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }

    @Test
    void importLookups_withoutFile_returnsDefaults() {
        LookupTables lookups = open().importLookups();

        assertThat(lookups.probabilityForStage(DealStage.PROPOSAL)).isEqualTo(60);
    }

    @Test
    @DisplayName("파일의 Lookups 값이 로드 시 normalize에 사용됨")
    void fileLookups_driveNormalization() throws Exception {
        TestWorkbooks.write(TestWorkbooks.v11(TestWorkbooks.row("D-1", "Acme", "Roof", "Proposal")), file);

        FileDealRepository repository = open();

        assertThat(repository.getById("D-1").orElseThrow().getProbability()).isEqualTo(55);
        Deal fresh = new Deal();
        fresh.setStage(DealStage.PROPOSAL);
        assertThat(repository.normalizer().normalize(fresh).getProbability()).isEqualTo(55);
    }

    @Test
    void filePath_isTheConfiguredPath() {
        assertThat(open().filePath()).isEqualTo(file);
    }
}
