package com.mlpromote.promotion;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Archive of finished runs, one JSON line per run.
 */
public class PromotionHistoryLog {
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Path historyPath;

    public PromotionHistoryLog(Path historyPath) {
        this.historyPath = historyPath;
    }

    public synchronized void append(RunSnapshot snapshot) throws IOException {
        if (historyPath.getParent() != null) {
            Files.createDirectories(historyPath.getParent());
        }
        String line = mapper.writeValueAsString(snapshot) + System.lineSeparator();
        Files.writeString(historyPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public synchronized List<RunSnapshot> readAll() throws IOException {
        if (!Files.exists(historyPath)) {
            return List.of();
        }
        List<RunSnapshot> snapshots = new ArrayList<>();
        for (String line : Files.readAllLines(historyPath)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            snapshots.add(mapper.readValue(line, RunSnapshot.class));
        }
        return snapshots;
    }

    public Optional<RunSnapshot> find(String runId) throws IOException {
        return readAll().stream()
                .filter(snapshot -> snapshot.runId().equals(runId))
                .findFirst();
    }
}
