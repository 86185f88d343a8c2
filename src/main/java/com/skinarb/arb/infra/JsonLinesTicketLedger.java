package com.skinarb.arb.infra;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.skinarb.arb.core.InMemoryTicketLedger;
import com.skinarb.arb.domain.ItemStatus;
import com.skinarb.arb.domain.ItemStatusChangeTicket;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Ticket ledger persisted as one JSON record per line. Each record is written
 * and flushed before it is added to memory, so a crash never leaves an applied
 * ticket off disk. The file is replayed into memory on startup; earlier
 * segments of a rebased asset stay in the file as history only.
 */
@Slf4j
public class JsonLinesTicketLedger extends InMemoryTicketLedger implements AutoCloseable {

    enum RecordKind {
        OPEN,
        REBASE,
        TICKET
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class LedgerRecord {
        private RecordKind kind;
        private String assetId;
        private ItemStatus status;
        private ItemStatusChangeTicket ticket;
    }

    private final Path file;
    private final ObjectMapper mapper;
    private final BufferedWriter writer;

    public JsonLinesTicketLedger(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            reload();
            this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open ticket ledger " + file, e);
        }
    }

    private void reload() throws IOException {
        if (!Files.exists(file)) {
            return;
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        int tickets = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            LedgerRecord record;
            try {
                record = mapper.readValue(line, LedgerRecord.class);
            } catch (IOException e) {
                // a torn last line from a crash mid-write is dropped
                if (i == lines.size() - 1) {
                    log.warn("Dropping incomplete last line of ticket ledger {}", file);
                    Files.write(file, lines.subList(0, i), StandardCharsets.UTF_8);
                    break;
                }
                throw e;
            }
            switch (record.getKind()) {
                case OPEN:
                    super.open(record.getAssetId(), record.getStatus());
                    break;
                case REBASE:
                    super.rebase(record.getAssetId(), record.getStatus());
                    break;
                default:
                    super.append(record.getAssetId(), record.getTicket());
                    tickets++;
                    break;
            }
        }
        log.info("Reloaded ticket ledger {}: {} assets, {} tickets", file, assetIds().size(), tickets);
    }

    @Override
    public synchronized void open(String assetId, ItemStatus initialStatus) {
        if (initialStatus(assetId).isPresent()) {
            return;
        }
        write(new LedgerRecord(RecordKind.OPEN, assetId, initialStatus, null));
        super.open(assetId, initialStatus);
    }

    @Override
    public synchronized void rebase(String assetId, ItemStatus observedStatus) {
        write(new LedgerRecord(RecordKind.REBASE, assetId, observedStatus, null));
        super.rebase(assetId, observedStatus);
    }

    @Override
    public void append(String assetId, ItemStatusChangeTicket ticket) {
        if (initialStatus(assetId).isEmpty()) {
            throw new IllegalStateException("Ticket log for asset " + assetId + " was never opened");
        }
        synchronized (this) {
            write(new LedgerRecord(RecordKind.TICKET, assetId, null, ticket));
        }
        super.append(assetId, ticket);
    }

    private void write(LedgerRecord record) {
        try {
            writer.write(mapper.writeValueAsString(record));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Ticket ledger write failed for asset " + record.getAssetId(), e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
