package me.golemcore.hub.adapter.outbound.storage;

import me.golemcore.hub.infrastructure.config.HubProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String SNAPSHOTS = "snapshots";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        HubProperties properties = new HubProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateHubDirectoriesOnInit() {
        for (String dir : LocalStorageAdapter.DIRECTORIES) {
            assertTrue(Files.isDirectory(tempDir.resolve(dir)), dir);
        }
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText("memory", "items.jsonl", "{\"id\":\"mem-000001\"}").get();

        assertEquals("{\"id\":\"mem-000001\"}", storageAdapter.getText("memory", "items.jsonl").get());
        assertTrue(storageAdapter.exists("memory", "items.jsonl").get());
    }

    @Test
    void getText_returnsNullForNonExisting() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText("sessions", "missing.json").get());
        assertFalse(storageAdapter.exists("sessions", "missing.json").get());
    }

    @Test
    void deleteObject_removesFile() throws ExecutionException, InterruptedException {
        storageAdapter.putText("sessions", "s1.json", "{}").get();

        storageAdapter.deleteObject("sessions", "s1.json").get();

        assertFalse(storageAdapter.exists("sessions", "s1.json").get());
        assertDoesNotThrow(() -> storageAdapter.deleteObject("sessions", "s1.json").get());
    }

    @Test
    void shouldListOnlyTheNamedSubdirectory() throws ExecutionException, InterruptedException {
        storageAdapter.putText(SNAPSHOTS, "s1/1.json", "{}").get();
        storageAdapter.putText(SNAPSHOTS, "s1/2.json", "{}").get();
        storageAdapter.putText(SNAPSHOTS, "s10/1.json", "{}").get();

        assertEquals(List.of("s1/1.json", "s1/2.json"), storageAdapter.listObjects(SNAPSHOTS, "s1").get());
        assertEquals(3, storageAdapter.listObjects(SNAPSHOTS, "").get().size());
        assertTrue(storageAdapter.listObjects(SNAPSHOTS, "s2").get().isEmpty());
        assertTrue(storageAdapter.listObjects("no-such-dir", null).get().isEmpty());
    }

    @Test
    void shouldReplaceAtomicallyAndKeepBackup() throws Exception {
        storageAdapter.putTextAtomic("sessions", "s1.json", "{\"v\":1}", true).get();
        storageAdapter.putTextAtomic("sessions", "s1.json", "{\"v\":2}", true).get();

        assertEquals("{\"v\":2}", storageAdapter.getText("sessions", "s1.json").get());
        assertEquals("{\"v\":1}", Files.readString(tempDir.resolve("sessions/s1.json.bak")));
        assertFalse(Files.exists(tempDir.resolve("sessions/s1.json.tmp")));
        assertEquals(List.of("s1.json"), storageAdapter.listObjects("sessions", "").get());
    }

    @Test
    void shouldNotInterleaveConcurrentAppends() throws ExecutionException, InterruptedException {
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            writes.add(storageAdapter.appendText("audit", "2026-03-01.jsonl", "line-" + i + "\n"));
        }
        CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).get();

        String[] lines = storageAdapter.getText("audit", "2026-03-01.jsonl").get().split("\n");
        assertEquals(50, lines.length);
        for (String line : lines) {
            assertTrue(line.matches("line-\\d+"), line);
        }
    }

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putText("memory", "../../etc/passwd", "hack").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void shouldBlockPathTraversalOnGet() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText("memory", "../../../secret").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }
}
