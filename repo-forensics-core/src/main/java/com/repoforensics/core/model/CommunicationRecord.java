package com.repoforensics.core.model;

import java.util.Objects;

/**
 * Collaboration between an author and a peer.
 *
 * @param author author display name
 * @param peer peer display name
 * @param sharedFiles number of files both changed
 * @param strength collaboration strength
 */
public record CommunicationRecord(String author, String peer, int sharedFiles, int strength) implements SourceRecord {

    public CommunicationRecord {
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(peer, "peer must not be null");
    }
}
