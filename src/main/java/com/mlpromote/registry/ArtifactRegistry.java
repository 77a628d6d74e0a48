package com.mlpromote.registry;

import java.io.IOException;
import java.util.Optional;

/**
 * Versioned model artifacts and their approval status. The promotion orchestrator only reads
 * artifacts and updates their status.
 */
public interface ArtifactRegistry {

    /**
     * @throws ArtifactNotFoundException when no artifact has the given id
     */
    ArtifactVersion getArtifact(String id) throws IOException;

    void setApprovalStatus(String id, ApprovalStatus status) throws IOException;

    void register(ArtifactVersion artifact) throws IOException;

    /**
     * Most recently created artifact of a group with the given status.
     */
    Optional<ArtifactVersion> latestWithStatus(String group, ApprovalStatus status) throws IOException;
}
