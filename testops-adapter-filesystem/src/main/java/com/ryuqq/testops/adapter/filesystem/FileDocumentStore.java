package com.ryuqq.testops.adapter.filesystem;

import com.ryuqq.testops.core.codec.DocumentCodec;
import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.spi.StorageException;
import com.ryuqq.testops.core.store.AbstractQueuedDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 파일 시스템 기반 DocumentStore 구현체.
 *
 * <p>프로젝트마다 {@code <dataDir>/projects/<projectId>/data.json} 파일 하나를 가지며,
 * 모든 쓰기는 {@link AtomicFileWriter}를 통해 원자적으로 교체됩니다.</p>
 *
 * <p><strong>실패 정책:</strong></p>
 * <ul>
 *   <li>파일 없음 → 빈 문서</li>
 *   <li>파싱 불가(손상) → ERROR 로그 후 빈 문서</li>
 *   <li>읽기/쓰기 I/O 실패 → {@link StorageException}, 기존 파일은 보존</li>
 * </ul>
 *
 * <p><strong>제약:</strong> 같은 데이터 디렉터리를 쓰는 인스턴스는 프로세스당 하나여야 합니다.
 * 키별 직렬화는 인스턴스 내부에서만 보장됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class FileDocumentStore extends AbstractQueuedDocumentStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileDocumentStore.class);

    private final FileStoreConfig config;
    private final DocumentCodec codec;
    private final AtomicFileWriter writer;
    private final ExecutorService executor;

    public FileDocumentStore(FileStoreConfig config) {
        this(config, new AtomicFileWriter());
    }

    FileDocumentStore(FileStoreConfig config, AtomicFileWriter writer) {
        this(config, writer, Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "document-store-io");
            thread.setDaemon(true);
            return thread;
        }));
    }

    private FileDocumentStore(FileStoreConfig config, AtomicFileWriter writer, ExecutorService executor) {
        super(executor);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (writer == null) {
            throw new IllegalArgumentException("writer cannot be null");
        }
        this.config = config;
        this.writer = writer;
        this.executor = executor;
        this.codec = new DocumentCodec(config.prettyPrint());
    }

    @Override
    protected ProjectDocument load(String key) {
        Path path = pathOf(key);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return ProjectDocument.empty();
        } catch (IOException e) {
            throw new StorageException(key, "Failed to read project document", e);
        }
        try {
            return codec.decode(bytes);
        } catch (IOException e) {
            log.error("Corrupt project document, treating as empty: key={}, path={}", key, path, e);
            return ProjectDocument.empty();
        }
    }

    @Override
    protected void persist(String key, ProjectDocument document) {
        Path path = pathOf(key);
        try {
            writer.write(path, codec.encode(document));
        } catch (IOException e) {
            throw new StorageException(key, "Failed to write project document", e);
        }
    }

    @Override
    protected void remove(String key) {
        Path path = pathOf(key);
        try {
            Files.deleteIfExists(path);
            Files.deleteIfExists(path.getParent());
        } catch (DirectoryNotEmptyException e) {
            log.debug("Project directory kept, not empty: {}", path.getParent());
        } catch (IOException e) {
            throw new StorageException(key, "Failed to delete project document", e);
        }
    }

    public Path documentPath(String key) {
        return pathOf(key);
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private Path pathOf(String key) {
        if (key.contains("/") || key.contains("\\") || key.equals(".") || key.equals("..")) {
            throw new IllegalArgumentException("Invalid project id for file storage: " + key);
        }
        return config.documentPath(key);
    }
}
