package com.ryuqq.testops.application.batch;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.testops.core.executor.BrowserOptions;
import com.ryuqq.testops.core.model.RunSource;
import com.ryuqq.testops.core.statemachine.RunStatus;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchConfig / BatchHandle 테스트.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
class BatchConfigTest {

    @Test
    void 기본값() {
        BatchConfig config = new BatchConfig();

        assertThat(config.browser()).isEqualTo("chrome");
        assertThat(config.headless()).isTrue();
        assertThat(config.environment()).isEqualTo("local");
        assertThat(config.source()).isEqualTo(RunSource.BATCH);
        assertThat(config.triggeredBy()).isEqualTo("user");
        assertThat(config.scheduleId()).isNull();
    }

    @Test
    void Suite_설정에서_읽고_없는_키는_기본값() {
        ObjectNode json = JsonNodeFactory.instance.objectNode()
            .put("browser", "edge")
            .put("headless", false)
            .put("unrelated", 1);

        BatchConfig config = BatchConfig.fromJson(json);

        assertThat(config.browser()).isEqualTo("edge");
        assertThat(config.headless()).isFalse();
        assertThat(config.environment()).isEqualTo("local");
        assertThat(config.browserOptions()).isEqualTo(new BrowserOptions("edge", false, "local"));
        assertThat(BatchConfig.fromJson(null)).isEqualTo(new BatchConfig());
    }

    @Test
    void 스케줄_실행_설정은_meta에_기록됨() {
        BatchConfig config = new BatchConfig()
            .withSource(RunSource.SCHEDULER)
            .withTriggeredBy("scheduler")
            .withScheduleId("sch-1")
            .withName("Nightly");

        ObjectNode meta = config.toJson();

        assertThat(meta.get("triggeredBy").asText()).isEqualTo("scheduler");
        assertThat(meta.get("scheduleId").asText()).isEqualTo("sch-1");
        assertThat(meta.get("name").asText()).isEqualTo("Nightly");
        assertThat(meta.get("headless").asBoolean()).isTrue();
        assertThat(config.source()).isEqualTo(RunSource.SCHEDULER);
    }

    @Test
    void 실패_핸들은_FAILED로_완료되어_있음() throws Exception {
        BatchHandle handle = BatchHandle.failed("run-1", "No files in project");

        assertThat(handle.isStarted()).isFalse();
        assertThat(handle.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(handle.getMessage()).isEqualTo("No files in project");
        assertThat(handle.getCompletion().get(1, TimeUnit.SECONDS)).isEqualTo(RunStatus.FAILED);
    }

    @Test
    void 시작_핸들의_completion은_복사본() {
        CompletableFuture<RunStatus> completion = new CompletableFuture<>();
        BatchHandle handle = BatchHandle.started("run-1", completion);

        handle.getCompletion().complete(RunStatus.COMPLETED);

        assertThat(completion).isNotDone();
        assertThat(handle.getMessage()).isEqualTo("Batch execution started.");
        assertThatThrownBy(() -> BatchHandle.started("run-1", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
