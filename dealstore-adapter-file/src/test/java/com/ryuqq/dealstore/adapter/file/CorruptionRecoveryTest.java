package com.ryuqq.dealstore.adapter.file;

import com.ryuqq.dealstore.adapter.file.table.Table;
import com.ryuqq.dealstore.adapter.file.table.Workbook;
import com.ryuqq.dealstore.core.context.SequentialDealIdGenerator;
import com.ryuqq.dealstore.core.context.SystemContext;
import com.ryuqq.dealstore.core.exception.IntegrityException;
import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.testkit.fixture.DealFixtures;
import com.ryuqq.dealstore.testkit.fixture.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Load-time recovery: an invalid durable file is replaced by its newest backup.
 *
 * @author DealStore Team
 * @since 1.0.0
 */
class CorruptionRecoveryTest {

    @TempDir
    Path tempDir;

    private Path file;
    private MutableClock clock;
    private SystemContext context;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("pipeline.json");
        clock = new MutableClock(Instant.parse("2025-03-15T10:00:00Z"));
        context = SystemContext.of(clock, new SequentialDealIdGenerator(LocalDate.of(2025, 3, 15)));
    }

    @Test
    @DisplayName("손상된 파일은 최신 백업으로 복원 후 로드")
    void corruptFile_isRestoredFromNewestBackup() throws Exception {
        FileDealRepository writer = open();
        writer.upsert(DealFixtures.deal("D-1"));
        writer.saveChanges();
        clock.advance(Duration.ofSeconds(1));
        writer.upsert(DealFixtures.deal("D-2"));
        writer.saveChanges();
        Files.writeString(file, "{\"format\":\"dealstore-workbook\",\"tables\":[", StandardCharsets.UTF_8);

        FileDealRepository reader = open();

        assertThat(reader.getAll()).extracting(Deal::getDealId).containsExactly("D-1");
        assertThat(reader.validate().valid()).isTrue();
    }

    @Test
    void missingRequiredColumn_triggersRestore() throws Exception {
        FileDealRepository writer = open();
        writer.upsert(DealFixtures.deal("D-1"));
        writer.saveChanges();
        clock.advance(Duration.ofSeconds(1));
        writer.upsert(DealFixtures.deal("D-2"));
        writer.saveChanges();
        Workbook broken = new Workbook();
        Table deals = broken.addTable(Workbook.DEALS);
        deals.addRow("DealId", "AccountName", "Stage");
        TestWorkbooks.write(broken, file);

        assertThat(open().getAll()).hasSize(1);
    }

    @Test
    @DisplayName("이름이 겹치는 다른 저장소의 백업으로는 복원하지 않음")
    void corruptFile_ignoresBackupsOfSiblingStore() throws Exception {
        Path archiveFile = tempDir.resolve("pipeline_archive.json");
        FileDealRepository archive = new FileDealRepository(archiveFile, context, new FileStoreConfig());
        for (int i = 0; i < 3; i++) {
            archive.upsert(DealFixtures.deal("ARCH-" + i));
            archive.saveChanges();
            clock.advance(Duration.ofSeconds(1));
        }
        FileDealRepository main = new FileDealRepository(file, context, new FileStoreConfig().withMaxBackups(1));
        for (int i = 0; i < 3; i++) {
            main.upsert(DealFixtures.deal("MAIN-" + i));
            main.saveChanges();
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(main.backups())
            .extracting(p -> p.getFileName().toString())
            .containsExactly("pipeline_20250315_100005.json.bak");
        assertThat(archive.backups()).hasSize(2);

        Files.writeString(file, "corrupt", StandardCharsets.UTF_8);
        FileDealRepository reader = open();

        assertThat(reader.getAll()).extracting(Deal::getDealId).containsExactly("MAIN-0", "MAIN-1");
        assertThat(archive.backups()).hasSize(2);
    }

    @Test
    void corruptFileWithoutBackup_throwsIntegrityException() throws Exception {
        Files.writeString(file, "not json at all", StandardCharsets.UTF_8);

        FileDealRepository reader = open();

        assertThatThrownBy(reader::getAll)
            .isInstanceOf(IntegrityException.class)
            .hasMessageContaining("no backup is available");
    }

    @Test
    void corruptBackup_throwsIntegrityExceptionWithErrors() throws Exception {
        Files.writeString(file, "[]", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("pipeline_20250101_000000.json.bak"), "{}", StandardCharsets.UTF_8);

        FileDealRepository reader = open();

        assertThatThrownBy(reader::getAll)
            .isInstanceOfSatisfying(IntegrityException.class,
                e -> assertThat(e.getErrors()).isNotEmpty())
            .hasMessageContaining("after restoring backup");
    }

    private FileDealRepository open() {
        return new FileDealRepository(file, context, new FileStoreConfig());
    }
}
