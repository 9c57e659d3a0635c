package com.percussion.scoredb.ingest;

/**
 * Division label plus the optional scheduling block within it.
 */
public record ClassificationBlock(String label, Integer block) {

    public boolean hasBlock() {
        return block != null;
    }
}
