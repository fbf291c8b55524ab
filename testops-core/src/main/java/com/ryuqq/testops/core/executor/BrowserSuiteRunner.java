package com.ryuqq.testops.core.executor;

import java.nio.file.Path;
import java.util.List;

/**
 * 브라우저 스크립트 묶음을 외부 프로세스 한 번으로 실행하는 실행자.
 *
 * <p>배치 안의 브라우저 스크립트 전체가 한 번의 호출로 실행되며,
 * 결과는 스위트 전체의 종료 코드와 출력으로 보고됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public interface BrowserSuiteRunner {

    /**
     * 스위트 실행.
     *
     * @param files 실행할 스크립트 경로 (workDir 기준 상대 경로 또는 절대 경로)
     * @param options 브라우저 옵션
     * @param workDir 프로세스 작업 디렉토리
     * @return 스위트 전체 실행 결과
     */
    ExecutionResult run(List<Path> files, BrowserOptions options, Path workDir);
}
