package com.mlpromote.registry;

public class ArtifactNotFoundException extends IllegalArgumentException {

    public ArtifactNotFoundException(String artifactId) {
        super("Unknown artifact version: " + artifactId);
    }
}
