package io.github.yok.sheetlink.progress;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import io.github.yok.sheetlink.core.BatchOutcome;
import io.github.yok.sheetlink.core.BatchResult;
import io.github.yok.sheetlink.mapping.ImportMode;
import io.github.yok.sheetlink.schema.TableIdentifier;
import java.time.Instant;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class LoggingProgressSinkTest {

    private final LoggingProgressSink sink = new LoggingProgressSink();

    @Test
    void onProgress_正常ケース_総数の有無_例外なく出力されること() {
        assertDoesNotThrow(() -> sink.onProgress(new ProgressEvent("op", 1, 5, 4, 1, 10)));
        assertDoesNotThrow(() -> sink.onProgress(new ProgressEvent("op", 1, 5, 4, 1, -1)));
    }

    @Test
    void onFinished_正常ケース_結果を渡す_例外なく出力されること() {
        Instant now = Instant.now();
        BatchResult result = BatchResult.builder().operationId("op").mode(ImportMode.UPDATE)
                .table(new TableIdentifier(null, "PUBLIC", "T")).attempted(1).succeeded(1)
                .failed(0).failures(Collections.emptyList()).outcome(BatchOutcome.COMPLETED)
                .startedAt(now).finishedAt(now.plusMillis(5)).build();

        assertDoesNotThrow(() -> sink.onFinished(result));
    }
}
