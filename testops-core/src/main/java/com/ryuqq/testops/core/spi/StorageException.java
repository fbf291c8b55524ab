package com.ryuqq.testops.core.spi;

/**
 * 영속화 계층 I/O 실패.
 *
 * <p>원인 예외({@link java.io.IOException} 등)를 감싸 호출자에게 전달합니다.
 * 호출자가 상위 계층의 오류(예: HTTP 500)로 변환할 책임을 집니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class StorageException extends RuntimeException {

    private final String key;

    public StorageException(String key, String message, Throwable cause) {
        super(message + " [key=" + key + "]", cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
