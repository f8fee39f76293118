package me.golemcore.hub.testsupport;

import me.golemcore.hub.port.outbound.StoragePort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link StoragePort} for unit tests.
 */
public class InMemoryStoragePort implements StoragePort {

    private final Map<String, String> files = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        files.put(key(directory, path), content);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.completedFuture(files.get(key(directory, path)));
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.completedFuture(files.containsKey(key(directory, path)));
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        files.remove(key(directory, path));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        // prefix names a file or subdirectory, as in the local file adapter
        String base = directory + "/";
        String start = prefix == null || prefix.isEmpty() ? base : base + prefix;
        List<String> result = new ArrayList<>();
        for (String key : files.keySet()) {
            boolean under = start.equals(base) ? key.startsWith(base)
                    : key.equals(start) || key.startsWith(start.endsWith("/") ? start : start + "/");
            if (under && !key.endsWith(".tmp") && !key.endsWith(".bak")) {
                result.add(key.substring(base.length()));
            }
        }
        result.sort(String::compareTo);
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public synchronized CompletableFuture<Void> appendText(String directory, String path, String content) {
        files.merge(key(directory, path), content, String::concat);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return putText(directory, path, content);
    }

    public String read(String directory, String path) {
        return files.get(key(directory, path));
    }

    public void write(String directory, String path, String content) {
        files.put(key(directory, path), content);
    }

    private static String key(String directory, String path) {
        return directory + "/" + path;
    }
}
