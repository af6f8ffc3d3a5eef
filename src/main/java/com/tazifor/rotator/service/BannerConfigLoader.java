package com.tazifor.rotator.service;

import com.tazifor.rotator.config.RotatorProperties;
import com.tazifor.rotator.model.BannerRecord;
import com.tazifor.rotator.model.LoadResult;
import com.tazifor.rotator.model.ValidationError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * BannerConfigLoader - Banner CSV Import
 *
 * FORMAT (no header, variable width, one banner per line):
 *   url;amount;category1[;category2;...]
 *
 * EXAMPLE:
 *   http://banners.com/banner0.jpg;17;flight;hotel
 *   http://banners.com/banner1.jpg;250;car
 *
 * RULES:
 * - fields are trimmed
 * - a field may be double quoted; inside quotes the delimiter is plain text
 *   and "" stands for one quote (http://a/x.jpg?a=1;b=2 needs quoting)
 * - empty category fields are dropped
 * - blank lines are skipped
 * - a bad line is logged and skipped, the rest of the file still loads
 */
@Slf4j
@Component
public class BannerConfigLoader {

    /**
     * Stand-in amount for a missing or unparsable field; the store rejects it as
     * {@link ValidationError#ILLEGAL_IMPRESSION_AMOUNT}.
     */
    static final int INVALID_AMOUNT = 0;

    private static final char QUOTE = '"';

    @Autowired
    private RotationService rotationService;

    @Autowired
    private RotatorProperties properties;

    /**
     * Load every banner of {@code file}
     *
     * @throws UncheckedIOException if the file can't be read
     */
    public LoadSummary load(Path file) {
        log.info("Loading banners from {}", file.toAbsolutePath());
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader, file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Can't read banner config " + file, e);
        }
    }

    LoadSummary load(Reader source, String sourceName) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        String delimiter = properties.getDelimiter();
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalStateException("rotator.delimiter must not be empty");
        }

        int loaded = 0;
        int rejected = 0;
        Map<ValidationError, Integer> reasons = new EnumMap<>(ValidationError.class);

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }

            BannerRecord record = parse(line, delimiter);
            LoadResult result = rotationService.load(record);

            if (result.isSuccess()) {
                loaded++;
            } else {
                rejected++;
                ValidationError error = result.getError().orElseThrow();
                reasons.merge(error, 1, Integer::sum);
                log.warn("{}:{} skipped ({}): {}", sourceName, lineNumber, error.getDescription(), line);
            }
        }

        log.info("Loaded {} banners from {} ({} rejected)", loaded, sourceName, rejected);
        return new LoadSummary(sourceName, loaded, rejected, reasons);
    }

    static BannerRecord parse(String line, String delimiter) {
        List<String> fields = split(line, delimiter);

        String url = fields.get(0);
        int total = fields.size() > 1 ? parseAmount(fields.get(1)) : INVALID_AMOUNT;

        List<String> categories = new ArrayList<>();
        for (int i = 2; i < fields.size(); i++) {
            String category = fields.get(i);
            if (!category.isEmpty()) {
                categories.add(category);
            }
        }

        return BannerRecord.builder()
            .url(url)
            .total(total)
            .categories(categories)
            .build();
    }

    /**
     * Split on {@code delimiter} outside double quotes; quotes are removed and
     * every field is trimmed. An unterminated quote runs to the end of the line.
     */
    static List<String> split(String line, String delimiter) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;

        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == QUOTE) {
                if (quoted && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                    field.append(QUOTE);
                    i += 2;
                    continue;
                }
                quoted = !quoted;
                i++;
            } else if (!quoted && line.startsWith(delimiter, i)) {
                fields.add(field.toString().trim());
                field.setLength(0);
                i += delimiter.length();
            } else {
                field.append(c);
                i++;
            }
        }
        fields.add(field.toString().trim());
        return fields;
    }

    private static int parseAmount(String field) {
        try {
            return Integer.parseInt(field);
        } catch (NumberFormatException e) {
            log.debug("Unparsable impression amount '{}'", field);
            return INVALID_AMOUNT;
        }
    }
}
