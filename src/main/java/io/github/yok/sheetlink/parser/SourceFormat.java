package io.github.yok.sheetlink.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported source containers.
 *
 * <p>
 * Each format defines the file extensions recognized as belonging to it. For example,
 * {@link #XLSX} covers both {@code .xlsx} and the macro-enabled {@code .xlsm}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SourceFormat {

    // Office Open XML workbook, read as a stream.
    XLSX("xlsx", "xlsm"),

    // Legacy binary (BIFF8) workbook.
    XLS("xls"),

    // Delimited text.
    CSV("csv", "txt");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    SourceFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves the format owning an extension.
     *
     * @param ext file extension (without dot)
     * @return matching format, or empty when unsupported
     */
    public static Optional<SourceFormat> fromExtension(String ext) {
        for (SourceFormat format : values()) {
            if (format.matches(ext)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
