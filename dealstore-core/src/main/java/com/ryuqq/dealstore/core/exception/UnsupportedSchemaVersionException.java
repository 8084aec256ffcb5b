package com.ryuqq.dealstore.core.exception;

import java.util.List;

/**
 * The durable file declares a schema version this build cannot read or migrate.
 *
 * <p>Nothing is loaded when this is thrown.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class UnsupportedSchemaVersionException extends DealStoreException {

    private final String version;
    private final List<String> supportedVersions;

    public UnsupportedSchemaVersionException(String version, List<String> supportedVersions) {
        super("Unsupported schema version: " + version + ". Supported versions: "
            + String.join(", ", supportedVersions));
        this.version = version;
        this.supportedVersions = List.copyOf(supportedVersions);
    }

    public String getVersion() {
        return version;
    }

    public List<String> getSupportedVersions() {
        return supportedVersions;
    }
}
