package com.mlpromote.promotion;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Appends every event as one JSON line.
 */
public class JsonLinesNotificationSink implements NotificationSink {
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Path eventLogPath;

    public JsonLinesNotificationSink(Path eventLogPath) {
        this.eventLogPath = eventLogPath;
    }

    @Override
    public synchronized void publish(PromotionEvent event) {
        try {
            if (eventLogPath.getParent() != null) {
                Files.createDirectories(eventLogPath.getParent());
            }
            String line = mapper.writeValueAsString(event) + System.lineSeparator();
            Files.writeString(eventLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to append event to " + eventLogPath, e);
        }
    }

    public synchronized List<PromotionEvent> readAll() throws IOException {
        if (!Files.exists(eventLogPath)) {
            return List.of();
        }
        List<PromotionEvent> events = new ArrayList<>();
        for (String line : Files.readAllLines(eventLogPath)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            events.add(mapper.readValue(line, PromotionEvent.class));
        }
        return events;
    }
}
