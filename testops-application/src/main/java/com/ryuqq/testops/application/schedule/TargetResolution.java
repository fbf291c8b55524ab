package com.ryuqq.testops.application.schedule;

import com.ryuqq.testops.application.batch.BatchConfig;

import java.util.List;

/**
 * 스케줄 대상 해석 결과.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public sealed interface TargetResolution
    permits TargetResolution.SuiteTarget, TargetResolution.SingleFileTarget, TargetResolution.NotFound {

    /**
     * Suite 대상. Suite의 파일 목록과 기본 설정으로 실행합니다.
     */
    record SuiteTarget(String suiteId, List<String> fileIds, BatchConfig config) implements TargetResolution {

        public SuiteTarget {
            fileIds = fileIds == null ? List.of() : List.copyOf(fileIds);
            config = config == null ? new BatchConfig() : config;
        }
    }

    /**
     * 단일 파일 (또는 레거시 스크립트) 대상.
     */
    record SingleFileTarget(String fileId) implements TargetResolution {
    }

    /**
     * 대상 없음.
     */
    record NotFound(String targetId, String reason) implements TargetResolution {
    }
}
