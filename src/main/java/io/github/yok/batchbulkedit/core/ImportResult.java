package io.github.yok.batchbulkedit.core;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Counts of nodes created, updated and deleted by one import.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class ImportResult {

    public static final ImportResult EMPTY = new ImportResult(0, 0, 0);

    private final int created;
    private final int updated;
    private final int deleted;

    /**
     * Adds the counts of another result.
     *
     * @param other result to add
     * @return summed result
     */
    public ImportResult plus(ImportResult other) {
        return new ImportResult(created + other.created, updated + other.updated,
                deleted + other.deleted);
    }

    /**
     * Renders the counts as {@code created=N, updated=N, deleted=N}.
     *
     * @return summary text
     */
    public String summary() {
        return "created=" + created + ", updated=" + updated + ", deleted=" + deleted;
    }
}
