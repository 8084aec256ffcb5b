package com.ryuqq.dealstore.adapter.file;

import java.util.List;

/**
 * 파일 저장소 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxBackups: 보관할 백업 파일 수 (기본 5)</li>
 *   <li>lockMaxAttempts: lock marker 생성 시도 횟수 (기본 10)</li>
 *   <li>lockBaseDelayMs / lockMaxDelayMs: 재시도 backoff 범위 (기본 100ms / 2000ms)</li>
 *   <li>lockJitterFactor: backoff jitter 비율 (기본 0.1)</li>
 *   <li>currentSchemaVersion: 커밋 시 기록하는 버전 (기본 "1.2")</li>
 *   <li>supportedSchemaVersions: 읽을 수 있는 버전 (기본 1.0, 1.1, 1.2)</li>
 * </ul>
 *
 * <p>기본값으로 lock 대기는 최대 약 10초입니다 (100+200+400+800+1600+2000*4ms).</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public record FileStoreConfig(
    int maxBackups,
    int lockMaxAttempts,
    long lockBaseDelayMs,
    long lockMaxDelayMs,
    double lockJitterFactor,
    String currentSchemaVersion,
    List<String> supportedSchemaVersions
) {

    public static final String CURRENT_SCHEMA_VERSION = "1.2";
    public static final List<String> SUPPORTED_SCHEMA_VERSIONS = List.of("1.0", "1.1", "1.2");

    /**
     * 기본 설정 생성자.
     */
    public FileStoreConfig() {
        this(5, 10, 100, 2000, 0.1, CURRENT_SCHEMA_VERSION, SUPPORTED_SCHEMA_VERSIONS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FileStoreConfig {
        if (maxBackups < 0) {
            throw new IllegalArgumentException(
                "maxBackups must be >= 0 (current: " + maxBackups + ")"
            );
        }
        if (lockMaxAttempts <= 0) {
            throw new IllegalArgumentException(
                "lockMaxAttempts must be positive (current: " + lockMaxAttempts + ")"
            );
        }
        if (lockBaseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "lockBaseDelayMs must be positive (current: " + lockBaseDelayMs + ")"
            );
        }
        if (lockMaxDelayMs < lockBaseDelayMs) {
            throw new IllegalArgumentException(
                "lockMaxDelayMs must be >= lockBaseDelayMs (base: " + lockBaseDelayMs + ", max: " + lockMaxDelayMs + ")"
            );
        }
        if (lockJitterFactor < 0.0 || lockJitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "lockJitterFactor must be between 0.0 and 1.0 (current: " + lockJitterFactor + ")"
            );
        }
        if (currentSchemaVersion == null || currentSchemaVersion.isBlank()) {
            throw new IllegalArgumentException("currentSchemaVersion cannot be blank");
        }
        if (supportedSchemaVersions == null || !supportedSchemaVersions.contains(currentSchemaVersion)) {
            throw new IllegalArgumentException(
                "supportedSchemaVersions must contain currentSchemaVersion (current: " + currentSchemaVersion + ")"
            );
        }
        supportedSchemaVersions = List.copyOf(supportedSchemaVersions);
    }

    public FileStoreConfig withMaxBackups(int maxBackups) {
        return new FileStoreConfig(maxBackups, lockMaxAttempts, lockBaseDelayMs, lockMaxDelayMs,
            lockJitterFactor, currentSchemaVersion, supportedSchemaVersions);
    }

    public FileStoreConfig withLockMaxAttempts(int lockMaxAttempts) {
        return new FileStoreConfig(maxBackups, lockMaxAttempts, lockBaseDelayMs, lockMaxDelayMs,
            lockJitterFactor, currentSchemaVersion, supportedSchemaVersions);
    }

    /**
     * lock backoff 범위를 변경한 새 인스턴스 생성.
     *
     * @param lockBaseDelayMs 첫 재시도 지연
     * @param lockMaxDelayMs 최대 지연
     * @return 새 FileStoreConfig 인스턴스
     */
    public FileStoreConfig withLockDelays(long lockBaseDelayMs, long lockMaxDelayMs) {
        return new FileStoreConfig(maxBackups, lockMaxAttempts, lockBaseDelayMs, lockMaxDelayMs,
            lockJitterFactor, currentSchemaVersion, supportedSchemaVersions);
    }

    public FileStoreConfig withLockJitterFactor(double lockJitterFactor) {
        return new FileStoreConfig(maxBackups, lockMaxAttempts, lockBaseDelayMs, lockMaxDelayMs,
            lockJitterFactor, currentSchemaVersion, supportedSchemaVersions);
    }

    /**
     * 스키마 버전 설정을 변경한 새 인스턴스 생성.
     *
     * @param currentSchemaVersion 커밋 시 기록할 버전
     * @param supportedSchemaVersions 읽을 수 있는 버전 (currentSchemaVersion 포함)
     * @return 새 FileStoreConfig 인스턴스
     */
    public FileStoreConfig withSchemaVersions(String currentSchemaVersion, List<String> supportedSchemaVersions) {
        return new FileStoreConfig(maxBackups, lockMaxAttempts, lockBaseDelayMs, lockMaxDelayMs,
            lockJitterFactor, currentSchemaVersion, supportedSchemaVersions);
    }
}
