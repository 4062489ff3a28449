package io.github.yok.sheetlink.mapping;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads {@link FieldMapping}s from a JSON definition file or from inline {@code Source=Target}
 * pairs.
 *
 * <pre>
 * {
 *   "mappings": [
 *     { "source": "ID", "target": "Id", "key": true },
 *     { "source": "Name", "target": "CustomerName" },
 *     { "source": "Amount", "target": "Total", "coercion": { "locale": "en-US" } },
 *     { "source": "Date", "target": "CreatedOn", "coercion": { "datePattern": "DD/MM/YYYY" } },
 *     { "target": "Region", "constant": "EU" },
 *     { "target": "Notes", "skip": true }
 *   ]
 * }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MappingDefinitionLoader {

    private final ObjectMapper objectMapper;

    public MappingDefinitionLoader() {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Loads a JSON mapping definition.
     *
     * @param file definition file
     * @return mappings in file order
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws IllegalArgumentException if an entry is incomplete or contradictory
     */
    public List<FieldMapping> load(Path file) throws IOException {
        Definition definition = objectMapper.readValue(file.toFile(), Definition.class);
        if (definition.getMappings() == null || definition.getMappings().isEmpty()) {
            throw new IllegalArgumentException("No mappings defined in " + file);
        }
        List<FieldMapping> mappings = new ArrayList<>();
        int index = 0;
        for (Entry entry : definition.getMappings()) {
            mappings.add(toFieldMapping(entry, file + " mappings[" + index++ + "]"));
        }
        log.info("Loaded {} mappings from {}", mappings.size(), file);
        return mappings;
    }

    /**
     * Builds field mappings from inline pairs.
     *
     * @param pairs values such as {@code Name=CustomerName}
     * @return mappings in argument order
     * @throws IllegalArgumentException if a pair is malformed
     */
    public List<FieldMapping> parseInline(List<String> pairs) {
        List<FieldMapping> mappings = new ArrayList<>();
        for (String pair : pairs) {
            int eq = pair.lastIndexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                throw new IllegalArgumentException(
                        "Invalid mapping '" + pair + "', expected Source=Target");
            }
            mappings.add(FieldMapping.field(pair.substring(0, eq).trim(),
                    pair.substring(eq + 1).trim()));
        }
        return mappings;
    }

    /**
     * Flags the mapping of a target column as the update key.
     *
     * @param mappings mappings to adjust
     * @param keyColumn target column name (case-insensitive)
     * @return adjusted copy; unchanged when no mapping targets the column
     */
    public List<FieldMapping> withKey(List<FieldMapping> mappings, String keyColumn) {
        List<FieldMapping> result = new ArrayList<>(mappings.size());
        for (FieldMapping mapping : mappings) {
            if (mapping.getTargetColumn().equalsIgnoreCase(keyColumn) && !mapping.isKey()) {
                result.add(mapping.asKey());
            } else {
                result.add(mapping);
            }
        }
        return result;
    }

    private FieldMapping toFieldMapping(Entry entry, String location) {
        if (StringUtils.isBlank(entry.getTarget())) {
            throw new IllegalArgumentException(location + ": target is required");
        }
        int sources = (entry.getSource() != null ? 1 : 0) + (entry.isConstantPresent() ? 1 : 0)
                + (entry.isSkip() ? 1 : 0);
        if (sources != 1) {
            throw new IllegalArgumentException(
                    location + ": exactly one of source, constant or skip is required");
        }
        FieldMapping mapping;
        if (entry.isSkip()) {
            mapping = FieldMapping.skip(entry.getTarget());
        } else if (entry.isConstantPresent()) {
            mapping = FieldMapping.constant(entry.getTarget(), entry.getConstant());
        } else {
            mapping = FieldMapping.field(entry.getSource(), entry.getTarget());
        }
        if (entry.getCoercion() != null) {
            mapping = mapping.withCoercion(toRule(entry.getCoercion(), location));
        }
        return entry.isKey() ? mapping.asKey() : mapping;
    }

    private CoercionRule toRule(Rule rule, String location) {
        CoercionRule.CoercionRuleBuilder builder = CoercionRule.builder()
                .datePattern(rule.getDatePattern()).locale(rule.getLocale())
                .decimalSeparator(singleChar(rule.getDecimalSeparator(), location))
                .groupingSeparator(singleChar(rule.getGroupingSeparator(), location));
        if (rule.getTrim() != null) {
            builder.trim(rule.getTrim());
        }
        if (rule.getBlankAsNull() != null) {
            builder.blankAsNull(rule.getBlankAsNull());
        }
        if (rule.getBinaryEncoding() != null) {
            try {
                builder.binaryEncoding(CoercionRule.BinaryEncoding
                        .valueOf(rule.getBinaryEncoding().trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(location + ": unknown binaryEncoding '"
                        + rule.getBinaryEncoding() + "' (HEX or BASE64)", e);
            }
        }
        return builder.build();
    }

    private static Character singleChar(String value, String location) {
        if (value == null) {
            return null;
        }
        if (value.length() != 1) {
            throw new IllegalArgumentException(
                    location + ": separator must be a single character, got '" + value + "'");
        }
        return value.charAt(0);
    }

    /**
     * JSON root.
     */
    @Data
    static class Definition {
        private List<Entry> mappings;
    }

    /**
     * One JSON mapping entry.
     */
    @Data
    static class Entry {
        private String target;
        private String source;
        private Object constant;
        private boolean constantPresent;
        private boolean skip;
        private boolean key;
        private Rule coercion;

        public void setConstant(Object constant) {
            this.constant = constant;
            this.constantPresent = true;
        }
    }

    /**
     * JSON coercion rule.
     */
    @Data
    static class Rule {
        private String datePattern;
        private String locale;
        private String decimalSeparator;
        private String groupingSeparator;
        private Boolean trim;
        private Boolean blankAsNull;
        private String binaryEncoding;
    }
}
