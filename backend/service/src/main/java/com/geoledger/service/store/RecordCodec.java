package com.geoledger.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoledger.core.util.JsonUtils;

import java.io.IOException;

public final class RecordCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private RecordCodec() {
    }

    public static String toJsonLine(JournalEntry entry) {
        try {
            return MAPPER.writeValueAsString(entry);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize journal entry for " + entry.ticketKey(), e);
        }
    }

    public static JournalEntry fromJsonLine(String line) {
        try {
            return MAPPER.readValue(line, JournalEntry.class);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize journal entry", e);
        }
    }
}
