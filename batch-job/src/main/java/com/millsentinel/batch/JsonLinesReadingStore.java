package com.millsentinel.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.millsentinel.core.model.Reading;
import com.millsentinel.core.store.InMemoryReadingStore;
import com.millsentinel.core.store.ReadingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ReadingStore} over a JSON-lines export of the plant historian.
 *
 * <p>
 * Each non-blank line is one JSON object keyed by historian column name
 * ({@code "Date & Time"}, {@code "Mill TPH"}, ...); see
 * {@link Reading#fromColumns(Map)}. Malformed lines, including lines that are
 * not valid UTF-8, are logged and dropped so that a single bad record does not
 * fail the run. The parsed readings are
 * then cleaned once, when the file is loaded.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesReadingStore implements ReadingStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesReadingStore.class);

    private static final TypeReference<Map<String, Object>> COLUMNS = new TypeReference<>() {
    };

    private final InMemoryReadingStore delegate;
    private final InputSummary summary;

    private JsonLinesReadingStore(InMemoryReadingStore delegate, InputSummary summary) {
        this.delegate = delegate;
        this.summary = summary;
    }

    /**
     * Read and clean the readings of {@code path}.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws IOException              if the file cannot be read
     */
    public static JsonLinesReadingStore load(Path path) throws IOException {
        Objects.requireNonNull(path, "Input path must not be null");
        ObjectMapper mapper = new ObjectMapper();

        List<Reading> raw = new ArrayList<>();
        int lineNumber = 0;
        int linesRead = 0;
        int malformed = 0;
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            byte[] bytes;
            while ((bytes = nextLine(in)) != null) {
                lineNumber++;
                String line;
                try {
                    line = decoder.decode(ByteBuffer.wrap(bytes)).toString();
                } catch (CharacterCodingException e) {
                    linesRead++;
                    malformed++;
                    LOG.warn("Skipping line {} of {}: not valid UTF-8", lineNumber, path);
                    continue;
                }
                if (line.isBlank()) {
                    continue;
                }
                linesRead++;
                Map<String, Object> columns;
                try {
                    columns = mapper.readValue(line, COLUMNS);
                } catch (JsonProcessingException e) {
                    malformed++;
                    LOG.warn("Skipping malformed line {} of {}: {}", lineNumber, path, e.getOriginalMessage());
                    continue;
                }
                if (columns == null) {
                    malformed++;
                    LOG.warn("Skipping line {} of {}: not a JSON object", lineNumber, path);
                    continue;
                }
                raw.add(Reading.fromColumns(columns));
            }
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Reading file not found: " + path, e);
        }

        InMemoryReadingStore store = new InMemoryReadingStore(raw);
        InputSummary summary = new InputSummary(path.toString(), linesRead, malformed, store.getCleaning());
        LOG.info("Loaded {} reading(s) from {}", summary.getReadings(), path);
        return new JsonLinesReadingStore(store, summary);
    }

    /**
     * @return the bytes of the next line without its terminator ({@code \n},
     *         {@code \r\n} or {@code \r}), or {@code null} at end of input
     */
    private static byte[] nextLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b = in.read();
        if (b == -1) {
            return null;
        }
        while (b != -1 && b != '\n') {
            if (b == '\r') {
                in.mark(1);
                if (in.read() != '\n') {
                    in.reset();
                }
                break;
            }
            line.write(b);
            b = in.read();
        }
        return line.toByteArray();
    }

    @Override
    public List<Reading> readings() {
        return delegate.readings();
    }

    public InputSummary getSummary() {
        return summary;
    }
}
