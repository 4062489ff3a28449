package io.github.yok.sheetlink.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link FailureLog} that appends one UTF-8 line per event to a text file.
 *
 * <pre>
 * 2024-02-13T10:15:30+01:00 | op=3f2a9c1e | ROW | KEY_NOT_FOUND | row=42 | ... | {"Id":"7"}
 * 2024-02-13T10:15:31+01:00 | op=3f2a9c1e | FATAL | CONNECTION_LOST | row=- | ... | -
 * </pre>
 *
 * <p>
 * The snapshot is rendered as a JSON object of the raw values' string forms. Line breaks inside
 * details are flattened so that every event stays on one line. The parent directory is created on
 * first use.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FileFailureLog implements FailureLog {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Getter
    private final File file;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FileFailureLog(File file) {
        this.file = file;
    }

    @Override
    public synchronized void append(FailureEvent event) {
        String line = format(event);
        try {
            FileUtils.writeStringToFile(file, line + System.lineSeparator(),
                    StandardCharsets.UTF_8, true);
        } catch (IOException e) {
            log.error("Failed to write failure log {}: {} (event: {})", file, e.getMessage(),
                    line, e);
        }
    }

    String format(FailureEvent event) {
        StringBuilder sb = new StringBuilder(128);
        sb.append(TIMESTAMP.format(OffsetDateTime.ofInstant(event.getTimestamp(),
                ZoneId.systemDefault())));
        sb.append(" | op=").append(event.getOperationId());
        sb.append(" | ").append(event.getSeverity());
        sb.append(" | ").append(event.getCode());
        sb.append(" | row=").append(event.getRowNumber() == null ? "-" : event.getRowNumber());
        sb.append(" | ").append(flatten(event.getDetail()));
        sb.append(" | ").append(renderSnapshot(event.getSnapshot()));
        return sb.toString();
    }

    private String renderSnapshot(Map<String, Object> snapshot) {
        if (snapshot.isEmpty()) {
            return "-";
        }
        Map<String, String> strings = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : snapshot.entrySet()) {
            strings.put(e.getKey(), e.getValue() == null ? null : String.valueOf(e.getValue()));
        }
        try {
            return objectMapper.writeValueAsString(strings);
        } catch (JsonProcessingException e) {
            log.debug("Snapshot not serializable: {}", e.getMessage());
            return flatten(strings.toString());
        }
    }

    private static String flatten(String text) {
        if (text == null) {
            return "-";
        }
        return StringUtils.normalizeSpace(text.replace('\r', ' ').replace('\n', ' '));
    }
}
