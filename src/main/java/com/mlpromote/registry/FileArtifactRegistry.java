package com.mlpromote.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Registry kept in a single pretty-printed JSON file. Every operation re-reads the file so that
 * the CLI and a running orchestrator observe each other's updates.
 */
public class FileArtifactRegistry implements ArtifactRegistry {
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();
    private final Path registryPath;

    public FileArtifactRegistry(Path registryPath) {
        this.registryPath = registryPath;
    }

    @Override
    public synchronized ArtifactVersion getArtifact(String id) throws IOException {
        return load().artifacts().stream()
                .filter(artifact -> artifact.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new ArtifactNotFoundException(id));
    }

    @Override
    public synchronized void setApprovalStatus(String id, ApprovalStatus status) throws IOException {
        List<ArtifactVersion> artifacts = new ArrayList<>(load().artifacts());
        boolean found = false;
        for (int i = 0; i < artifacts.size(); i++) {
            if (artifacts.get(i).id().equals(id)) {
                artifacts.set(i, artifacts.get(i).withApprovalStatus(status));
                found = true;
            }
        }
        if (!found) {
            throw new ArtifactNotFoundException(id);
        }
        save(new RegistryState(artifacts));
    }

    @Override
    public synchronized void register(ArtifactVersion artifact) throws IOException {
        List<ArtifactVersion> artifacts = new ArrayList<>(load().artifacts());
        if (artifacts.stream().anyMatch(existing -> existing.id().equals(artifact.id()))) {
            throw new IllegalArgumentException("Artifact version already registered: " + artifact.id());
        }
        artifacts.add(artifact);
        save(new RegistryState(artifacts));
    }

    @Override
    public synchronized Optional<ArtifactVersion> latestWithStatus(String group, ApprovalStatus status) throws IOException {
        return load().artifacts().stream()
                .filter(artifact -> artifact.group().equals(group))
                .filter(artifact -> artifact.approvalStatus() == status)
                .filter(artifact -> artifact.createdAt() != null)
                .max(Comparator.comparing(ArtifactVersion::createdAt));
    }

    private RegistryState load() throws IOException {
        if (!Files.exists(registryPath) || Files.size(registryPath) == 0L) {
            return new RegistryState(List.of());
        }
        return objectMapper.readValue(registryPath.toFile(), RegistryState.class);
    }

    private void save(RegistryState state) throws IOException {
        if (registryPath.getParent() != null) {
            Files.createDirectories(registryPath.getParent());
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(registryPath.toFile(), state);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RegistryState(List<ArtifactVersion> artifacts) {
        public RegistryState {
            artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        }
    }
}
