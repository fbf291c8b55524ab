package com.ryuqq.testops.core.executor;

/**
 * 단일 파일 실행자.
 *
 * <p>파일 하나의 내용과 언어를 받아 실행하고 종료 코드와 출력을 돌려줍니다.
 * 배치 오케스트레이터는 이 인터페이스를 불투명한(opaque) 외부 능력으로 취급합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>블로킹 호출입니다. 느릴 수 있고 실패할 수 있습니다.</li>
 *   <li>자체 실행 기한을 강제해야 하며, 기한 초과는 {@link ExecutionResult#timedOut()}로 보고합니다.</li>
 *   <li>구현체는 thread-safe해야 합니다. 여러 파일이 동시에 실행됩니다.</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public interface CodeExecutor {

    /**
     * 코드 실행.
     *
     * @param content 파일 내용
     * @param language 언어 ("python", "java", "javascript", "typescript")
     * @return 실행 결과
     * @throws IllegalArgumentException 지원하지 않는 언어인 경우
     */
    ExecutionResult execute(String content, String language);
}
