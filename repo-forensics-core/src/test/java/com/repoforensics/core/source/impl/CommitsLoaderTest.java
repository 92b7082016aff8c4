package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.CommitRecord;
import com.repoforensics.core.source.LoadResult;
import com.repoforensics.core.source.SourceLoaderTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CommitsLoader}.
 */
class CommitsLoaderTest extends SourceLoaderTestBase {

    private final CommitsLoader loader = new CommitsLoader();

    @Test
    void load_readsCommitsWithTimezoneAwareDates() throws IOException {
        // Given
        createFile("commits.json", """
            {"commits": [
              {"hash": "a1", "author_name": "Jane", "author_email": "jane@example.com",
               "date": "2024-03-01T10:15:00+01:00", "message": "Add parser"}
            ]}
            """);

        // When
        LoadResult result = loader.load(context);

        // Then
        CommitRecord commit = result.recordsOf(CommitRecord.class).get(0);
        assertThat(commit.hash()).isEqualTo("a1");
        assertThat(commit.authorEmail()).isEqualTo("jane@example.com");
        assertThat(commit.timestamp()).isEqualTo(OffsetDateTime.of(2024, 3, 1, 10, 15, 0, 0, ZoneOffset.ofHours(1)));
        assertThat(commit.message()).isEqualTo("Add parser");
    }

    @Test
    void load_withUnparseableDate_keepsCommitWithoutTimestamp() throws IOException {
        createFile("commits.json", """
            [{"hash": "b2", "author_name": "John", "date": "last tuesday"}]
            """);

        LoadResult result = loader.load(context);

        List<CommitRecord> commits = result.recordsOf(CommitRecord.class);
        assertThat(commits).hasSize(1);
        assertThat(commits.get(0).hasTimestamp()).isFalse();
        assertThat(result.statistics().hasSkips()).isFalse();
    }

    @Test
    void load_withoutAuthor_usesUnknown() throws IOException {
        createFile("commits.json", "{\"commits\": [{\"hash\": \"c3\"}]}");

        LoadResult result = loader.load(context);

        assertThat(result.recordsOf(CommitRecord.class).get(0).authorName()).isEqualTo("Unknown");
    }

    @Test
    void parseDate_acceptsSupportedFormats() {
        assertThat(CommitsLoader.parseDate("2024-03-01T10:15:00Z")).isPresent();
        assertThat(CommitsLoader.parseDate("2024-03-01T10:15:00"))
            .contains(OffsetDateTime.of(2024, 3, 1, 10, 15, 0, 0, ZoneOffset.UTC));
        assertThat(CommitsLoader.parseDate("2024-03-01 10:15:00 -0500"))
            .contains(OffsetDateTime.of(2024, 3, 1, 10, 15, 0, 0, ZoneOffset.ofHours(-5)));
        assertThat(CommitsLoader.parseDate("01/03/2024")).isEmpty();
    }
}
