package com.bidradar.history;

import com.bidradar.config.CrawlerProperties;
import com.bidradar.crawl.model.ScoredRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only newline-delimited JSON log of every scored opportunity ever emitted.
 */
@Component
public class OpportunityHistoryStore {
    private static final Logger log = LoggerFactory.getLogger(OpportunityHistoryStore.class);

    private final Path historyFile;
    private final ObjectMapper objectMapper;

    @Autowired
    public OpportunityHistoryStore(CrawlerProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getData().getHistoryFile()), objectMapper);
    }

    public OpportunityHistoryStore(Path historyFile, ObjectMapper objectMapper) {
        this.historyFile = historyFile;
        this.objectMapper = objectMapper;
    }

    public Path historyFile() {
        return historyFile;
    }

    /**
     * Replays the log and collects every record id. Lines that are blank, not UTF-8, not JSON or carry no
     * textual {@code id} are skipped; a file that cannot be read at all is fatal.
     */
    public SeenOpportunityIds loadSeenIds() {
        if (!Files.exists(historyFile)) {
            log.info("No history at {}; starting with an empty seen set", historyFile);
            return SeenOpportunityIds.empty();
        }
        Set<String> ids = new HashSet<>();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        int skipped = 0;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(historyFile))) {
            ByteArrayOutputStream line = new ByteArrayOutputStream();
            int next;
            while ((next = in.read()) != -1) {
                if (next != '\n') {
                    line.write(next);
                    continue;
                }
                if (!collectId(line.toByteArray(), decoder, ids)) {
                    skipped++;
                }
                line.reset();
            }
            if (line.size() > 0 && !collectId(line.toByteArray(), decoder, ids)) {
                skipped++;
            }
        } catch (NoSuchFileException e) {
            return SeenOpportunityIds.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read history file " + historyFile, e);
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed line(s) in {}", skipped, historyFile);
        }
        log.info("Loaded {} known opportunity id(s) from {}", ids.size(), historyFile);
        return SeenOpportunityIds.of(ids);
    }

    /**
     * Appends the batch in one write while holding an exclusive lock on the log file.
     */
    public void append(List<ScoredRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        StringBuilder batch = new StringBuilder();
        for (ScoredRecord record : records) {
            try {
                batch.append(objectMapper.writeValueAsString(record)).append('\n');
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Unable to serialize record " + record.id(), e);
            }
        }
        ByteBuffer buffer = ByteBuffer.wrap(batch.toString().getBytes(StandardCharsets.UTF_8));
        try {
            Path parent = historyFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(
                historyFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND
            );
                 FileLock ignored = channel.lock()) {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to append to history file " + historyFile, e);
        }
        log.info("Appended {} record(s) to {}", records.size(), historyFile);
    }

    /**
     * Returns false when the line is skipped: not valid UTF-8, not JSON, or without a textual id.
     * Blank lines are ignored without counting.
     */
    private boolean collectId(byte[] raw, CharsetDecoder decoder, Set<String> ids) {
        String line;
        try {
            line = decoder.reset().decode(ByteBuffer.wrap(raw)).toString();
        } catch (CharacterCodingException e) {
            return false;
        }
        if (line.isBlank()) {
            return true;
        }
        String id = readId(line);
        if (id == null) {
            return false;
        }
        ids.add(id);
        return true;
    }

    private String readId(String line) {
        try {
            JsonNode node = objectMapper.readTree(line);
            if (node == null || !node.isObject()) {
                return null;
            }
            JsonNode id = node.get("id");
            if (id == null || !id.isTextual() || id.asText().isBlank()) {
                return null;
            }
            return id.asText();
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
