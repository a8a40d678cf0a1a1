package com.stacker.projector;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Receives projected documents one chunk at a time.
 */
@FunctionalInterface
public interface ChunkHandler {

    void accept(List<Map<String, Object>> documents) throws IOException;
}
