package io.github.yok.sheetlink.mapping;

import io.github.yok.sheetlink.parser.SourceRow;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of projecting one source row: either a {@link MappedRow} or a rejection.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RowProjection {

    private final SourceRow source;
    private final MappedRow mappedRow;
    private final RejectionReason reason;
    private final String column;
    private final String detail;

    static RowProjection accepted(MappedRow row) {
        return new RowProjection(row.getSource(), row, null, null, null);
    }

    static RowProjection rejected(SourceRow source, RejectionReason reason, String column,
            String detail) {
        return new RowProjection(source, null, reason, column, detail);
    }

    public boolean isAccepted() {
        return mappedRow != null;
    }
}
