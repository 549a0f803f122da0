package com.crossvenue.arb.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * One JSON object per line. Journal failures are logged and never interrupt trading.
 */
@Slf4j
public class JsonLinesTradeJournal implements TradeJournal, Closeable {

    private final Path path;
    private final ObjectMapper objectMapper;
    private BufferedWriter writer;

    public JsonLinesTradeJournal(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void append(JournalRecord record) {
        try {
            BufferedWriter out = writer();
            out.write(objectMapper.writeValueAsString(record));
            out.newLine();
            out.flush();
        } catch (IOException e) {
            log.warn("Journal write to {} failed for {} record: {}", path, record.type(), e.getMessage());
        }
    }

    private BufferedWriter writer() throws IOException {
        if (writer == null) {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        }
        return writer;
    }

    @Override
    public synchronized void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }
}
