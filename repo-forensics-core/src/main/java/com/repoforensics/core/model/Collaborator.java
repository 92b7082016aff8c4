package com.repoforensics.core.model;

import java.util.Objects;

/**
 * A collaboration edge from one developer to a peer.
 *
 * @param name peer display name
 * @param sharedFiles number of files both developers changed
 * @param strength collaboration strength reported by the communication source
 */
public record Collaborator(String name, int sharedFiles, int strength) {

    public Collaborator {
        Objects.requireNonNull(name, "name must not be null");
    }
}
