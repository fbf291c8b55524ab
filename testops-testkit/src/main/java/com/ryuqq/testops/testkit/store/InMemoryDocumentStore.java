package com.ryuqq.testops.testkit.store;

import com.ryuqq.testops.core.codec.DocumentCodec;
import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.spi.StorageException;
import com.ryuqq.testops.core.store.AbstractQueuedDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of DocumentStore for testing purposes.
 *
 * <p>Documents are kept as serialized JSON bytes, so every read returns an independent copy
 * and a mutation outside a transaction never leaks into the stored state.</p>
 *
 * <p><strong>Test Hooks:</strong></p>
 * <ul>
 *   <li>{@link #putRaw(String, String)}: seeds raw (possibly corrupt) bytes</li>
 *   <li>{@link #failNextWrites(int)}: makes the next N persists throw {@link StorageException}</li>
 *   <li>{@link #writeCount()}: number of successful persists</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class InMemoryDocumentStore extends AbstractQueuedDocumentStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, byte[]> documents = new ConcurrentHashMap<>();
    private final AtomicInteger pendingFailures = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();
    private final Set<String> rejectedKeys = ConcurrentHashMap.newKeySet();
    private final DocumentCodec codec;
    private final ExecutorService executor;

    public InMemoryDocumentStore() {
        this(Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "inmemory-store");
            thread.setDaemon(true);
            return thread;
        }));
    }

    private InMemoryDocumentStore(ExecutorService executor) {
        super(executor);
        this.executor = executor;
        this.codec = new DocumentCodec(false);
    }

    @Override
    protected ProjectDocument load(String key) {
        requireAccepted(key);
        byte[] bytes = documents.get(key);
        if (bytes == null) {
            return ProjectDocument.empty();
        }
        try {
            return codec.decode(bytes);
        } catch (IOException e) {
            log.error("Corrupt document, treating as empty: key={}", key, e);
            return ProjectDocument.empty();
        }
    }

    @Override
    protected void persist(String key, ProjectDocument document) {
        requireAccepted(key);
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new StorageException(key, "Injected write failure", new IOException("injected"));
        }
        documents.put(key, codec.encode(document));
        writes.incrementAndGet();
    }

    @Override
    protected void remove(String key) {
        documents.remove(key);
    }

    public void putRaw(String key, String json) {
        documents.put(key, json.getBytes(StandardCharsets.UTF_8));
    }

    public boolean contains(String key) {
        return documents.containsKey(key);
    }

    public void failNextWrites(int count) {
        pendingFailures.set(count);
    }

    /**
     * 이 키에 대한 읽기/쓰기를 파일 저장소가 잘못된 ID를 거부하듯 IllegalArgumentException으로 실패시킴.
     */
    public void rejectKey(String key) {
        rejectedKeys.add(key);
    }

    public int writeCount() {
        return writes.get();
    }

    public void clear() {
        documents.clear();
        pendingFailures.set(0);
        writes.set(0);
        rejectedKeys.clear();
    }

    private void requireAccepted(String key) {
        if (rejectedKeys.contains(key)) {
            throw new IllegalArgumentException("Invalid project id for storage: " + key);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
