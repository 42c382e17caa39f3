package com.ryuqq.lifecycle.core.exception;

/**
 * 알려진 마이그레이션보다 최신인 스키마 버전.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class UnsupportedSchemaVersionException extends PersistenceException {

    private final String source;
    private final int schemaVersion;
    private final int supportedVersion;

    public UnsupportedSchemaVersionException(String source, int schemaVersion, int supportedVersion) {
        super("UNSUPPORTED_SCHEMA_VERSION",
            String.format("Feature record %s has schema_version %d, newest supported is %d",
                source, schemaVersion, supportedVersion),
            null);
        this.source = source;
        this.schemaVersion = schemaVersion;
        this.supportedVersion = supportedVersion;
    }

    public String getSource() {
        return source;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public int getSupportedVersion() {
        return supportedVersion;
    }
}
