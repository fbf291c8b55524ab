package com.ryuqq.testops.testkit.contract;

import com.ryuqq.testops.core.spi.DocumentStore;
import com.ryuqq.testops.core.spi.StorageException;
import com.ryuqq.testops.testkit.store.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * InMemoryDocumentStore가 DocumentStore 계약을 만족하는지 검증.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
class InMemoryDocumentStoreContractTest extends AbstractDocumentStoreContractTest {

    private InMemoryDocumentStore inMemory;

    @Override
    protected DocumentStore createStore() {
        inMemory = new InMemoryDocumentStore();
        return inMemory;
    }

    @Test
    void 손상된_문서는_빈_문서로_읽힘() throws Exception {
        inMemory.putRaw(KEY, "{\"testRuns\": [ {");

        assertTrue(await(store.read(KEY)).isEmpty());
    }

    @Test
    void 쓰기_실패는_StorageException으로_전달되고_기존_문서는_유지() throws Exception {
        // given
        await(store.write(KEY, sampleDocument()));
        inMemory.failNextWrites(1);

        // when
        CompletableFuture<Void> failed = store.transact(KEY, document -> document.getFiles().clear());

        // then
        ExecutionException exception = assertThrows(ExecutionException.class, () -> await(failed));
        assertInstanceOf(StorageException.class, exception.getCause());
        assertEquals(1, await(store.read(KEY)).getFiles().size());
        assertEquals(1, inMemory.writeCount());
    }
}
