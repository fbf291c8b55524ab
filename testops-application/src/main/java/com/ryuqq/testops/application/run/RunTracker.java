package com.ryuqq.testops.application.run;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.testops.core.model.Ids;
import com.ryuqq.testops.core.model.LogEntry;
import com.ryuqq.testops.core.model.LogLevel;
import com.ryuqq.testops.core.model.Project;
import com.ryuqq.testops.core.model.Run;
import com.ryuqq.testops.core.model.RunSource;
import com.ryuqq.testops.core.spi.DocumentStore;
import com.ryuqq.testops.core.spi.ProjectRegistry;
import com.ryuqq.testops.core.statemachine.RunStatus;
import com.ryuqq.testops.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Run 생명주기 추적기.
 *
 * <p>Run 레코드의 생성/로그 추가/업데이트/조회/삭제를 담당합니다. 로그는 메모리 버퍼에 즉시 추가되고,
 * Run별 flush 체인을 통해 추가된 순서대로 프로젝트 문서에 영속화됩니다.</p>
 *
 * <p><strong>로그 흐름:</strong></p>
 * <pre>
 * appendLog(a) → buffer [a]     → flush#1 enqueue ─┐
 * appendLog(b) → buffer [a, b]  → flush#2 enqueue ─┼─ flush#2는 flush#1 완료 후에만 시작
 *                                                  │
 * flush#1: snapshot [a, b] → transact(logs += a, b) → buffer에서 제거
 * flush#2: snapshot []     → no-op
 * </pre>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>같은 Run의 로그는 append 순서대로 영속화됩니다.</li>
 *   <li>버퍼의 항목은 영속화가 끝난 뒤에만 제거되므로, {@link #getDetails}는 항목을 누락하거나
 *       중복하지 않습니다 (sequence 기준 병합).</li>
 *   <li>서로 다른 Run의 flush 체인은 독립적입니다.</li>
 *   <li>종료 상태(COMPLETED/FAILED)가 된 Run은 더 이상 변경되지 않습니다.</li>
 * </ul>
 *
 * <p><strong>제약:</strong> 이 프로세스에서 생성하지 않은 Run(재시작 이전의 Run, 이미 종료된 Run)에 대한
 * {@link #appendLog}는 WARN 로그를 남기고 무시됩니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class RunTracker {

    private static final Logger log = LoggerFactory.getLogger(RunTracker.class);

    private final DocumentStore store;
    private final ProjectRegistry projectRegistry;
    private final RunTrackerConfig config;
    private final Map<String, RunBuffer> buffers = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param store 프로젝트 문서 저장소
     * @param projectRegistry 전체 프로젝트 조회용 ({@link #findRun})
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RunTracker(DocumentStore store, ProjectRegistry projectRegistry, RunTrackerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (projectRegistry == null) {
            throw new IllegalArgumentException("projectRegistry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.projectRegistry = projectRegistry;
        this.config = config;
    }

    public CompletableFuture<String> create(String projectId, List<String> fileIds, RunSource source, String triggeredBy) {
        return create(projectId, fileIds, source, triggeredBy, null);
    }

    /**
     * 새 Run 생성 (RUNNING).
     *
     * <p>프로젝트의 Run 목록 맨 앞에 추가하고, retentionCap을 넘는 가장 오래된 Run을 제거합니다.</p>
     *
     * @param projectId 프로젝트 ID
     * @param fileIds 참조 파일 ID 목록
     * @param source 발생 주체 (null이면 MANUAL)
     * @param triggeredBy 실행 요청자
     * @param meta 초기 메타데이터 (null 허용)
     * @return 생성된 Run ID
     * @throws IllegalArgumentException projectId가 null/blank인 경우
     */
    public CompletableFuture<String> create(String projectId, List<String> fileIds, RunSource source,
                                            String triggeredBy, ObjectNode meta) {
        requireText(projectId, "projectId");
        String runId = Ids.runId();
        Run run = Run.started(runId, projectId, fileIds, source, triggeredBy);
        if (meta != null) {
            run.setMeta(meta.deepCopy());
        }

        return store.transactAndGet(projectId, document -> {
            List<Run> runs = document.getTestRuns();
            runs.add(0, run);
            List<String> evicted = new ArrayList<>();
            while (runs.size() > config.retentionCap()) {
                evicted.add(runs.remove(runs.size() - 1).getId());
            }
            return evicted;
        }).thenApply(evicted -> {
            evicted.forEach(buffers::remove);
            buffers.put(runId, new RunBuffer(projectId));
            log.debug("Run created: runId={}, projectId={}, source={}, evicted={}",
                runId, projectId, run.getSource(), evicted.size());
            return runId;
        });
    }

    public CompletableFuture<Void> appendLog(String runId, String projectId, String message, LogLevel level) {
        return appendLog(runId, projectId, message, level, null);
    }

    /**
     * 로그 추가.
     *
     * <p>버퍼 추가는 동기적으로 수행되어 즉시 {@link #getDetails}에 보이며, 영속화는 Run의 flush 체인에
     * 예약됩니다. 반환된 future는 이 항목이 포함된 flush가 끝나면 완료됩니다 (실패해도 정상 완료).</p>
     *
     * @param runId Run ID
     * @param projectId 프로젝트 ID
     * @param message 메시지
     * @param level 심각도 (null이면 INFO)
     * @param metadata 구조화된 부가 정보 (null 허용)
     * @return flush 완료 future
     */
    public CompletableFuture<Void> appendLog(String runId, String projectId, String message, LogLevel level,
                                             JsonNode metadata) {
        requireText(runId, "runId");
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        RunBuffer buffer = buffers.get(runId);
        if (buffer == null) {
            log.warn("Log for untracked run dropped: runId={}, projectId={}, message={}", runId, projectId, message);
            return CompletableFuture.completedFuture(null);
        }
        buffer.append(level, message, metadata);
        return buffer.chain(() -> flush(runId, buffer));
    }

    /**
     * Run 업데이트 (필드 단위 병합).
     *
     * <p>먼저 Run의 flush 체인 전체를 기다린 뒤, 하나의 transact 안에서 patch를 병합합니다.
     * 종료 상태로 전이하면 아직 버퍼에 남은 로그를 함께 기록하고 버퍼와 체인을 폐기합니다.</p>
     *
     * @param runId Run ID
     * @param projectId 프로젝트 ID
     * @param patch 병합할 필드
     * @return 업데이트된 Run
     *         (실패: Run이 없거나 이미 종료 상태이면 {@link IllegalStateException})
     */
    public CompletableFuture<Run> update(String runId, String projectId, RunPatch patch) {
        requireText(runId, "runId");
        requireText(projectId, "projectId");
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        RunBuffer buffer = buffers.get(runId);
        CompletableFuture<Void> pending = buffer != null ? buffer.current() : CompletableFuture.completedFuture(null);

        return pending
            .thenCompose(ignored -> store.transactAndGet(projectId, document -> {
                Run run = document.findRun(runId)
                    .orElseThrow(() -> new IllegalStateException("Run not found: " + runId));
                RunStatus target = patch.status() != null ? patch.status() : run.getStatus();
                StateTransition.validate(runId, run.getStatus(), target);

                patch.applyTo(run);
                if (target.isTerminal()) {
                    if (run.getEndTime() == null) {
                        run.setEndTime(Instant.now());
                    }
                    if (buffer != null) {
                        appendUnpersisted(run, buffer.snapshot());
                    }
                }
                return run;
            }))
            .thenApply(run -> {
                if (run.isTerminal()) {
                    buffers.remove(runId);
                    log.info("Run finished: runId={}, status={}, results={}",
                        runId, run.getStatus(), run.getResults().size());
                }
                return run;
            });
    }

    /**
     * Run 상세 조회 (영속 로그 + 아직 flush되지 않은 버퍼 로그).
     *
     * @param projectId 프로젝트 ID
     * @param runId Run ID
     * @return Run (없으면 empty)
     */
    public CompletableFuture<Optional<Run>> getDetails(String projectId, String runId) {
        requireText(projectId, "projectId");
        requireText(runId, "runId");
        // 버퍼 snapshot을 먼저 떠야 함: 그 이후 버퍼에서 빠진 항목은 이미 영속화된 상태
        RunBuffer buffer = buffers.get(runId);
        List<LogEntry> buffered = buffer != null ? buffer.snapshot() : List.of();

        return store.read(projectId).thenApply(document -> document.findRun(runId).map(run -> {
            if (buffered.isEmpty()) {
                return run;
            }
            List<LogEntry> merged = new ArrayList<>(run.getLogs());
            appendUnpersisted(merged, run.lastLogSequence(), buffered);
            return run.withLogs(merged);
        }));
    }

    /**
     * Run 삭제. 버퍼와 flush 체인도 폐기합니다.
     *
     * @return 삭제되었으면 true
     */
    public CompletableFuture<Boolean> delete(String projectId, String runId) {
        requireText(projectId, "projectId");
        requireText(runId, "runId");
        buffers.remove(runId);
        return store.transactAndGet(projectId, document ->
            document.getTestRuns().removeIf(run -> runId.equals(run.getId())));
    }

    /**
     * 프로젝트의 Run 목록 (최신순).
     *
     * @param projectId 프로젝트 ID
     * @param sourceFilter 발생 주체 필터 (null이면 전체)
     */
    public CompletableFuture<List<Run>> listRuns(String projectId, RunSource sourceFilter) {
        requireText(projectId, "projectId");
        return store.read(projectId).thenApply(document -> {
            List<Run> runs = new ArrayList<>();
            for (Run run : document.getTestRuns()) {
                if (sourceFilter == null || sourceFilter == run.getSource()) {
                    runs.add(run);
                }
            }
            return runs;
        });
    }

    /**
     * 등록된 모든 프로젝트에서 Run ID로 검색.
     *
     * @param runId Run ID
     * @return 찾은 Run (버퍼 로그 포함)
     */
    public CompletableFuture<Optional<Run>> findRun(String runId) {
        requireText(runId, "runId");
        CompletableFuture<Optional<Run>> result = CompletableFuture.completedFuture(Optional.empty());
        for (Project project : projectRegistry.findAll()) {
            result = result.thenCompose(found -> found.isPresent()
                ? CompletableFuture.completedFuture(found)
                : lookupIn(project.id(), runId));
        }
        return result;
    }

    /**
     * 읽을 수 없는 프로젝트는 건너뜀.
     */
    private CompletableFuture<Optional<Run>> lookupIn(String projectId, String runId) {
        CompletableFuture<Optional<Run>> details;
        try {
            details = getDetails(projectId, runId);
        } catch (RuntimeException e) {
            details = CompletableFuture.failedFuture(e);
        }
        return details.exceptionally(error -> {
            log.warn("Skipping unreadable project in run lookup: projectId={}, runId={}", projectId, runId, error);
            return Optional.empty();
        });
    }

    /**
     * 추적 중인(버퍼가 있는) Run인지 확인.
     */
    public boolean isTracking(String runId) {
        return buffers.containsKey(runId);
    }

    private CompletableFuture<Void> flush(String runId, RunBuffer buffer) {
        List<LogEntry> pending = buffer.snapshot();
        if (pending.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        long flushedUpTo = pending.get(pending.size() - 1).sequence();

        return store.transactAndGet(buffer.projectId, document -> {
            Optional<Run> found = document.findRun(runId);
            if (found.isEmpty()) {
                return FlushOutcome.RUN_MISSING;
            }
            Run run = found.get();
            if (run.isTerminal()) {
                return FlushOutcome.RUN_TERMINAL;
            }
            appendUnpersisted(run, pending);
            return FlushOutcome.APPLIED;
        }).handle((outcome, error) -> {
            if (error != null) {
                log.error("Failed to flush logs, will retry with next flush: runId={}, entries={}",
                    runId, pending.size(), error);
                return null;
            }
            if (outcome != FlushOutcome.APPLIED) {
                log.warn("Log flush skipped: runId={}, reason={}, entries={}", runId, outcome, pending.size());
            }
            buffer.removeUpTo(flushedUpTo);
            return null;
        });
    }

    private static void appendUnpersisted(Run run, List<LogEntry> entries) {
        appendUnpersisted(run.getLogs(), run.lastLogSequence(), entries);
    }

    private static void appendUnpersisted(List<LogEntry> target, long lastPersisted, List<LogEntry> entries) {
        for (LogEntry entry : entries) {
            if (entry.sequence() > lastPersisted) {
                target.add(entry);
            }
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    private enum FlushOutcome {
        APPLIED,
        RUN_MISSING,
        RUN_TERMINAL
    }

    /**
     * Run 하나의 로그 버퍼와 flush 체인.
     */
    private static final class RunBuffer {

        private final String projectId;
        private final List<LogEntry> entries = new ArrayList<>();
        private long sequence;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        private RunBuffer(String projectId) {
            this.projectId = projectId;
        }

        synchronized void append(LogLevel level, String message, JsonNode metadata) {
            entries.add(new LogEntry(Instant.now(), level, message, metadata, ++sequence));
        }

        synchronized List<LogEntry> snapshot() {
            return new ArrayList<>(entries);
        }

        synchronized void removeUpTo(long flushedSequence) {
            entries.removeIf(entry -> entry.sequence() <= flushedSequence);
        }

        synchronized CompletableFuture<Void> chain(Supplier<CompletableFuture<Void>> flush) {
            tail = tail.thenCompose(ignored -> flush.get());
            return tail;
        }

        synchronized CompletableFuture<Void> current() {
            return tail;
        }
    }
}
