package io.cronhook;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Minimal durable object store used for execution metrics.
 */
public interface ObjectStore {

    void put(String key, byte[] content, String contentType, Map<String, String> metadata) throws IOException;

    /**
     * Keys under {@code prefix}, at most {@code maxKeys} of them, in lexicographic order.
     */
    List<String> list(String prefix, int maxKeys) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException if the key does not exist
     */
    byte[] get(String key) throws IOException;
}
