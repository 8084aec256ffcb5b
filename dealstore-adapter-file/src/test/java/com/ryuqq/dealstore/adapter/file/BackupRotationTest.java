package com.ryuqq.dealstore.adapter.file;

import com.ryuqq.dealstore.core.context.SequentialDealIdGenerator;
import com.ryuqq.dealstore.core.context.SystemContext;
import com.ryuqq.dealstore.core.model.Deal;
import com.ryuqq.dealstore.testkit.fixture.DealFixtures;
import com.ryuqq.dealstore.testkit.fixture.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 백업 생성/정리/복원 테스트.
 *
 * <p>백업 이름의 타임스탬프는 주입된 clock에서 오므로 MutableClock으로 커밋마다 1초씩 진행합니다.</p>
 */
class BackupRotationTest {

    @TempDir
    Path tempDir;

    private Path file;
    private MutableClock clock;
    private FileDealRepository repository;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("pipeline.json");
        clock = new MutableClock(Instant.parse("2025-03-15T14:30:00Z"));
        SystemContext context = SystemContext.of(clock, new SequentialDealIdGenerator(LocalDate.of(2025, 3, 15)));
        repository = new FileDealRepository(file, context, new FileStoreConfig().withMaxBackups(3));
    }

    @Test
    void firstCommit_hasNothingToBackUp() {
        commitDeal("D-1");

        assertThat(repository.backups()).isEmpty();
    }

    @Test
    void backupName_usesClockTimestamp() {
        commitDeal("D-1");
        commitDeal("D-2");

        assertThat(repository.backups())
            .extracting(p -> p.getFileName().toString())
            .containsExactly("pipeline_20250315_143001.json.bak");
    }

    @Test
    @DisplayName("maxBackups를 넘는 오래된 백업은 삭제되고 최신 K개만 남음")
    void rotation_keepsNewestK() {
        for (int i = 1; i <= 6; i++) {
            commitDeal("D-" + i);
        }

        assertThat(repository.backups())
            .extracting(p -> p.getFileName().toString())
            .containsExactly(
                "pipeline_20250315_143005.json.bak",
                "pipeline_20250315_143004.json.bak",
                "pipeline_20250315_143003.json.bak");
    }

    @Test
    void restoreFromBackup_bringsBackPreviousCommit() {
        commitDeal("D-1");
        commitDeal("D-2");

        assertThat(repository.restoreFromBackup()).isPresent();

        assertThat(repository.getAll()).extracting(Deal::getDealId).containsExactly("D-1");
        assertThat(repository.isDirty()).isFalse();
    }

    @Test
    void restoreFromBackup_withoutBackups_changesNothing() {
        commitDeal("D-1");

        assertThat(repository.restoreFromBackup()).isEmpty();
        assertThat(repository.getAll()).hasSize(1);
    }

    private void commitDeal(String id) {
        repository.upsert(DealFixtures.deal(id));
        repository.saveChanges();
        clock.advance(Duration.ofSeconds(1));
    }
}
