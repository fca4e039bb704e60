package me.golemcore.repl.adapter.outbound.storage;

import me.golemcore.repl.infrastructure.config.ReplProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";
    private static final String CONTENT_DEFAULT = "content";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ReplProperties properties = new ReplProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesPreferencesDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve("preferences")));
    }

    @Test
    void getTextReadsAtomicWrite() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "test-file.txt", "Hello, World!", false).get();

        assertEquals("Hello, World!", storageAdapter.getText(TEST_DIR, "test-file.txt").get());
    }

    @Test
    void getTextOfMissingFileIsNull() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.txt").get());
    }

    @Test
    void putTextAtomicCreatesNestedDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("a/b", "c.txt", CONTENT_DEFAULT, false).get();

        assertTrue(Files.isDirectory(tempDir.resolve("a/b")));
    }

    @Test
    void putTextAtomicWritesAndLeavesNoTempFile() throws Exception {
        storageAdapter.putTextAtomic("preferences", "config.json", "{\"a\":1}", false).get();

        Path target = tempDir.resolve("preferences/config.json");
        assertEquals("{\"a\":1}", Files.readString(target, StandardCharsets.UTF_8));
        assertFalse(Files.exists(tempDir.resolve("preferences/config.json.tmp")));
        assertFalse(Files.exists(tempDir.resolve("preferences/config.json.bak")));
    }

    @Test
    void putTextAtomicKeepsBackupWhenAsked() throws Exception {
        storageAdapter.putTextAtomic("preferences", "config.json", "v1", false).get();
        storageAdapter.putTextAtomic("preferences", "config.json", "v2", true).get();

        assertEquals("v2", Files.readString(tempDir.resolve("preferences/config.json"), StandardCharsets.UTF_8));
        assertEquals("v1", Files.readString(tempDir.resolve("preferences/config.json.bak"), StandardCharsets.UTF_8));
    }

    @Test
    void putTextAtomicHandlesUnicode() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "u.txt", "añade ✓", false).get();

        assertEquals("añade ✓", storageAdapter.getText(TEST_DIR, "u.txt").get());
    }

    @Test
    void pathTraversalIsBlocked() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.putTextAtomic("..", "escape.txt", CONTENT_DEFAULT, false).join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertFalse(Files.exists(tempDir.getParent().resolve("escape.txt")));
    }
}
