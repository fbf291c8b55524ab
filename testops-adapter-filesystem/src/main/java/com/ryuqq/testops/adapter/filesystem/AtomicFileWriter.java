package com.ryuqq.testops.adapter.filesystem;

import com.ryuqq.testops.core.model.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * 임시 파일 + rename 방식의 원자적 파일 쓰기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 같은 디렉터리에 &lt;name&gt;.&lt;shortId&gt;.tmp 작성
 * 2. 대상 경로로 atomic move (교체)
 * 3. 실패 시 임시 파일 삭제 후 예외 전파 (대상 파일은 그대로)
 * </pre>
 *
 * <p>읽는 쪽은 항상 이전 전체 내용 또는 새 전체 내용만 보게 됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class AtomicFileWriter {

    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    static final String TEMP_SUFFIX = ".tmp";

    /**
     * 대상 파일을 원자적으로 교체합니다.
     *
     * @param target 대상 파일
     * @param bytes 기록할 내용
     * @throws IOException 쓰기 또는 교체 실패
     */
    public void write(Path target, byte[] bytes) throws IOException {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(target.getFileName() + "." + Ids.shortId() + TEMP_SUFFIX);

        try {
            Files.write(temp, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            move(temp, target);
        } catch (IOException e) {
            discard(temp, e);
            throw e;
        }
    }

    /**
     * 임시 파일을 대상 위치로 이동.
     */
    protected void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported, falling back to replace: target={}", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp, IOException cause) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.warn("Failed to remove temp file: {}", temp, e);
        }
    }
}
