package com.repoforensics.core.model;

/**
 * Marker for one decoded row of an input data source.
 *
 * <p>Each input source decodes into exactly one record type. Records are validated when they
 * are decoded, so downstream components never see half-parsed rows.
 *
 * @see CommitRecord
 * @see RevisionRecord
 * @see ComplexityRecord
 * @see OwnershipRecord
 * @see MainDeveloperRecord
 * @see CommunicationRecord
 * @see FragmentationRecord
 * @see CouplingRecord
 */
public interface SourceRecord {
}
