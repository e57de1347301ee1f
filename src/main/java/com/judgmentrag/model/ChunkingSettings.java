package com.judgmentrag.model;

import com.judgmentrag.exception.ConfigurationException;

/**
 * Validated window settings. Holding an instance means {@code 0 <= overlap < chunkSize}.
 */
public record ChunkingSettings(int chunkSize, int overlap) {

    public ChunkingSettings {
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunk_size must be positive, got " + chunkSize);
        }
        if (overlap < 0) {
            throw new ConfigurationException("overlap must not be negative, got " + overlap);
        }
        if (overlap >= chunkSize) {
            throw new ConfigurationException(
                    "overlap (" + overlap + ") must be smaller than chunk_size (" + chunkSize + ")");
        }
    }

    public int step() {
        return chunkSize - overlap;
    }
}
