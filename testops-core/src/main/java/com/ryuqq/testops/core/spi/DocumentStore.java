package com.ryuqq.testops.core.spi;

import com.ryuqq.testops.core.model.ProjectDocument;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Per-key exclusive-access document storage SPI.
 *
 * <p>Every project owns exactly one {@link ProjectDocument}. All reads and writes of that
 * document go through this interface, which serializes them per key.</p>
 *
 * <p><strong>Ordering Guarantees:</strong></p>
 * <ul>
 *   <li>Operations on the same key run in submission order (FIFO), one at a time</li>
 *   <li>An operation starts only after every earlier operation on the same key has fully
 *       completed, including its persistence</li>
 *   <li>Operations on different keys are independent and may run concurrently</li>
 * </ul>
 *
 * <p><strong>Durability:</strong></p>
 * <ul>
 *   <li>A write replaces the stored document atomically; readers never observe a partial document</li>
 *   <li>A failed write leaves the previously committed document untouched</li>
 * </ul>
 *
 * <p><strong>Error Model:</strong> storage failures complete the returned future exceptionally
 * with {@link StorageException}. Argument errors are thrown synchronously as
 * {@link IllegalArgumentException}.</p>
 *
 * <p><strong>Re-entrancy:</strong> an updater must not wait on another operation of the same key.
 * That operation is queued behind the updater itself and would never start.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public interface DocumentStore {

    /**
     * Reads the document stored under the key.
     *
     * <p>Returns a fresh empty document when nothing is stored. A stored document that cannot
     * be parsed is logged and treated as empty.</p>
     *
     * @param key project id
     * @return future of a private copy of the document
     * @throws IllegalArgumentException if key is null or blank
     */
    CompletableFuture<ProjectDocument> read(String key);

    /**
     * Replaces the document stored under the key.
     *
     * @param key project id
     * @param document document to persist
     * @return future completing once the document is durably replaced
     * @throws IllegalArgumentException if key is blank or document is null
     */
    CompletableFuture<Void> write(String key, ProjectDocument document);

    /**
     * Read-modify-write with a synchronous updater.
     *
     * <p>If the updater throws, nothing is written and the future completes exceptionally
     * with the updater's exception.</p>
     *
     * @param key project id
     * @param updater mutates the document in place
     * @return future completing once the mutated document is persisted
     */
    CompletableFuture<Void> transact(String key, Consumer<ProjectDocument> updater);

    /**
     * Read-modify-write whose updater returns a value.
     *
     * @param key project id
     * @param updater mutates the document and returns a value
     * @param <T> value type
     * @return future of the updater's value, completing after persistence
     */
    <T> CompletableFuture<T> transactAndGet(String key, Function<ProjectDocument, T> updater);

    /**
     * Read-modify-write whose updater completes asynchronously.
     *
     * <p>The key stays exclusively held until the stage returned by the updater completes and
     * the document has been persisted. A stage that completes exceptionally aborts the write.</p>
     *
     * @param key project id
     * @param updater mutates the document and returns a stage
     * @param <T> value type
     * @return future of the stage's value, completing after persistence
     */
    <T> CompletableFuture<T> transactAsync(String key, Function<ProjectDocument, ? extends CompletionStage<T>> updater);

    /**
     * Removes the document stored under the key. Missing documents are ignored.
     *
     * @param key project id
     * @return future completing once the document is gone
     */
    CompletableFuture<Void> delete(String key);
}
