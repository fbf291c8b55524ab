package com.ryuqq.testops.adapter.filesystem;

import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.spi.DocumentStore;
import com.ryuqq.testops.core.spi.StorageException;
import com.ryuqq.testops.testkit.contract.AbstractDocumentStoreContractTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileDocumentStore가 DocumentStore 계약을 만족하는지, 그리고 파일 고유의 실패 정책을 검증.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
class FileDocumentStoreContractTest extends AbstractDocumentStoreContractTest {

    @TempDir
    Path dataDir;

    private FileDocumentStore fileStore;

    @Override
    protected DocumentStore createStore() {
        fileStore = new FileDocumentStore(new FileStoreConfig().withDataDir(dataDir));
        return fileStore;
    }

    @Test
    void 문서는_projects_아래_프로젝트별_data_json에_저장됨() throws Exception {
        await(store.write(KEY, sampleDocument()));

        Path expected = dataDir.resolve("projects").resolve(KEY).resolve("data.json");
        assertThat(fileStore.documentPath(KEY)).isEqualTo(expected);
        assertThat(Files.readString(expected)).contains("\"files\"");
    }

    @Test
    void 손상된_파일은_빈_문서로_읽힘() throws Exception {
        Path path = fileStore.documentPath(KEY);
        Files.createDirectories(path.getParent());
        Files.writeString(path, "{\"testRuns\": [ {", StandardCharsets.UTF_8);

        assertThat(await(store.read(KEY)).isEmpty()).isTrue();
    }

    @Test
    void 빈_파일은_빈_문서로_읽힘() throws Exception {
        Path path = fileStore.documentPath(KEY);
        Files.createDirectories(path.getParent());
        Files.writeString(path, "  ", StandardCharsets.UTF_8);

        assertThat(await(store.read(KEY)).isEmpty()).isTrue();
    }

    @Test
    void rename_이전에_중단된_쓰기는_이전_문서를_남김() throws Exception {
        // given
        await(store.write(KEY, sampleDocument()));
        Path path = fileStore.documentPath(KEY);
        Files.writeString(path.resolveSibling("data.json.crashed.tmp"), "{\"files\": []}", StandardCharsets.UTF_8);

        // when
        ProjectDocument read = await(store.read(KEY));

        // then
        assertThat(read.getFiles()).hasSize(1);
    }

    @Test
    void 교체_실패시_StorageException과_함께_기존_파일과_디렉터리가_보존됨() throws Exception {
        // given
        fileStore.close();
        AtomicFileWriter failingMove = new AtomicFileWriter() {
            @Override
            protected void move(Path temp, Path target) throws IOException {
                throw new IOException("simulated crash before rename");
            }
        };
        FileDocumentStore healthy = new FileDocumentStore(new FileStoreConfig().withDataDir(dataDir));
        healthy.write(KEY, sampleDocument()).get();
        healthy.close();
        FileDocumentStore failing = new FileDocumentStore(new FileStoreConfig().withDataDir(dataDir), failingMove);

        try {
            // when
            CompletableFuture<Void> result = failing.transact(KEY, document -> document.getFiles().clear());

            // then
            assertThatThrownBy(() -> await(result))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(StorageException.class);
            assertThat(await(failing.read(KEY)).getFiles()).hasSize(1);
            assertThat(tempFiles(failing.documentPath(KEY).getParent())).isZero();
        } finally {
            failing.close();
        }
    }

    @Test
    void 파일_저장소에_쓸_수_없는_프로젝트_ID는_거부() {
        assertThatThrownBy(() -> await(store.read("../escape")))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void delete는_프로젝트_디렉터리까지_제거() throws Exception {
        await(store.write(KEY, sampleDocument()));

        await(store.delete(KEY));

        assertThat(Files.exists(fileStore.documentPath(KEY).getParent())).isFalse();
    }

    private static long tempFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(file -> file.getFileName().toString().endsWith(".tmp")).count();
        }
    }
}
