package com.ryuqq.testops.adapter.runner;

import com.ryuqq.testops.application.batch.BatchConfig;
import com.ryuqq.testops.application.batch.BatchHandle;
import com.ryuqq.testops.application.batch.BatchOrchestrator;
import com.ryuqq.testops.application.schedule.JobScheduler;
import com.ryuqq.testops.application.schedule.TargetResolution;
import com.ryuqq.testops.application.schedule.TargetResolver;
import com.ryuqq.testops.core.concurrent.Futures;
import com.ryuqq.testops.core.model.Ids;
import com.ryuqq.testops.core.model.Project;
import com.ryuqq.testops.core.model.ProjectDocument;
import com.ryuqq.testops.core.model.RunSource;
import com.ryuqq.testops.core.model.Schedule;
import com.ryuqq.testops.core.spi.DocumentStore;
import com.ryuqq.testops.core.spi.ProjectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Spring {@link TaskScheduler} + {@link CronTrigger} 기반 JobScheduler 구현체.
 *
 * <p><strong>Tick 처리:</strong></p>
 * <pre>
 * 1. TargetResolver.resolve(projectId, targetId)
 *    - SuiteTarget      → Suite 파일 목록 + Suite 설정
 *    - SingleFileTarget → [targetId] + {name: 스케줄 이름}
 *    - NotFound         → WARN 로그 후 종료
 * 2. source=SCHEDULER, triggeredBy="scheduler", scheduleId 설정
 * 3. BatchOrchestrator.executeBatch
 * </pre>
 *
 * <p>tick 중의 예외는 로그로만 남기며 타이머로 전파하지 않습니다.</p>
 *
 * <p><strong>Cron 형식:</strong> 5필드(분 단위)와 6필드(초 단위)를 모두 받습니다.
 * 5필드 표현식은 초 필드 0을 앞에 붙여 해석합니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public class CronJobScheduler implements JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(CronJobScheduler.class);

    static final String SCHEDULER_TRIGGER = "scheduler";

    private final DocumentStore store;
    private final ProjectRegistry projectRegistry;
    private final BatchOrchestrator orchestrator;
    private final TargetResolver targetResolver;
    private final ScheduleRegistry handles;
    private final TaskScheduler taskScheduler;
    private final SchedulerConfig config;
    private final ThreadPoolTaskScheduler ownedScheduler;

    /**
     * 생성자. 설정의 poolSize로 전용 ThreadPoolTaskScheduler를 만들어 사용합니다.
     */
    public CronJobScheduler(DocumentStore store, ProjectRegistry projectRegistry, BatchOrchestrator orchestrator,
                            TargetResolver targetResolver, ScheduleRegistry handles, SchedulerConfig config) {
        this(store, projectRegistry, orchestrator, targetResolver, handles, config, newTaskScheduler(config));
    }

    /**
     * 외부 TaskScheduler를 사용하는 생성자. 전달된 스케줄러의 수명은 호출자가 관리합니다.
     */
    public CronJobScheduler(DocumentStore store, ProjectRegistry projectRegistry, BatchOrchestrator orchestrator,
                            TargetResolver targetResolver, ScheduleRegistry handles, TaskScheduler taskScheduler,
                            SchedulerConfig config) {
        this(store, projectRegistry, orchestrator, targetResolver, handles, taskScheduler, config, null);
    }

    private CronJobScheduler(DocumentStore store, ProjectRegistry projectRegistry, BatchOrchestrator orchestrator,
                             TargetResolver targetResolver, ScheduleRegistry handles, SchedulerConfig config,
                             ThreadPoolTaskScheduler ownedScheduler) {
        this(store, projectRegistry, orchestrator, targetResolver, handles, ownedScheduler, config, ownedScheduler);
    }

    private CronJobScheduler(DocumentStore store, ProjectRegistry projectRegistry, BatchOrchestrator orchestrator,
                             TargetResolver targetResolver, ScheduleRegistry handles, TaskScheduler taskScheduler,
                             SchedulerConfig config, ThreadPoolTaskScheduler ownedScheduler) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (projectRegistry == null) {
            throw new IllegalArgumentException("projectRegistry cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (targetResolver == null) {
            throw new IllegalArgumentException("targetResolver cannot be null");
        }
        if (handles == null) {
            throw new IllegalArgumentException("handles cannot be null");
        }
        if (taskScheduler == null) {
            throw new IllegalArgumentException("taskScheduler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.projectRegistry = projectRegistry;
        this.orchestrator = orchestrator;
        this.targetResolver = targetResolver;
        this.handles = handles;
        this.taskScheduler = taskScheduler;
        this.config = config;
        this.ownedScheduler = ownedScheduler;
    }

    @Override
    public int init() {
        int registered = 0;
        for (Project project : projectRegistry.findAll()) {
            try {
                ProjectDocument document = Futures.await(store.read(project.id()));
                for (Schedule schedule : document.getSchedules()) {
                    if (schedule.isActive() && tryRegister(schedule)) {
                        registered++;
                    }
                }
            } catch (RuntimeException e) {
                log.error("Failed to load schedules: projectId={}", project.id(), e);
            }
        }
        log.info("Scheduler initialized: {} active schedules registered", registered);
        return registered;
    }

    @Override
    public Schedule create(String projectId, String userId, String targetId, String cronExpression, String name) {
        requireText(projectId, "projectId");
        requireText(userId, "userId");
        requireText(targetId, "targetId");
        CronTrigger trigger = trigger(cronExpression);

        Schedule schedule = new Schedule(Ids.shortId(), projectId, userId, name, cronExpression.trim(), targetId,
            true, Instant.now());
        Futures.await(store.transact(projectId, document -> document.getSchedules().add(schedule)));
        register(schedule, trigger);

        log.info("Schedule created: id={}, name={}, cron={}, target={}",
            schedule.getId(), schedule.displayName(), schedule.getCronExpression(), targetId);
        return schedule;
    }

    @Override
    public boolean delete(String scheduleId) {
        requireText(scheduleId, "scheduleId");
        boolean stopped = handles.unregister(scheduleId);

        Optional<String> owner = findOwnerProject(scheduleId);
        if (owner.isEmpty()) {
            log.debug("Schedule not persisted, nothing to delete: id={}, handleStopped={}", scheduleId, stopped);
            return false;
        }
        boolean removed = Futures.await(store.transactAndGet(owner.get(),
            document -> document.getSchedules().removeIf(schedule -> scheduleId.equals(schedule.getId()))));
        log.info("Schedule deleted: id={}, projectId={}", scheduleId, owner.get());
        return removed;
    }

    /**
     * 프로젝트의 스케줄 목록.
     *
     * <p>사용자별 필터링은 하지 않습니다. 프로젝트 접근 권한 확인은 호출자의 책임입니다.</p>
     */
    @Override
    public List<Schedule> list(String projectId, String userId) {
        requireText(projectId, "projectId");
        return new ArrayList<>(Futures.await(store.read(projectId)).getSchedules());
    }

    @Override
    public Schedule setActive(String scheduleId, boolean active) {
        requireText(scheduleId, "scheduleId");
        String projectId = findOwnerProject(scheduleId)
            .orElseThrow(() -> new IllegalStateException("Schedule not found: " + scheduleId));

        Schedule updated = Futures.await(store.transactAndGet(projectId, document -> {
            Schedule schedule = document.findSchedule(scheduleId)
                .orElseThrow(() -> new IllegalStateException("Schedule not found: " + scheduleId));
            schedule.setActive(active);
            return schedule;
        }));

        if (active) {
            register(updated, trigger(updated.getCronExpression()));
        } else {
            handles.unregister(scheduleId);
        }
        log.info("Schedule {}: id={}", active ? "resumed" : "paused", scheduleId);
        return updated;
    }

    @Override
    public void shutdown() {
        int cancelled = handles.cancelAll();
        if (ownedScheduler != null) {
            ownedScheduler.shutdown();
        }
        log.info("Scheduler shut down: {} handles cancelled", cancelled);
    }

    /**
     * 5필드 표현식은 초 필드를 앞에 붙여 6필드로 변환합니다.
     *
     * @throws IllegalArgumentException 필드 수가 5 또는 6이 아니거나 표현식이 유효하지 않은 경우
     */
    static String normalizeCron(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new IllegalArgumentException("cronExpression cannot be null or blank");
        }
        String trimmed = cronExpression.trim();
        int fields = trimmed.split("\\s+").length;
        String normalized;
        if (fields == 5) {
            normalized = "0 " + trimmed;
        } else if (fields == 6) {
            normalized = trimmed;
        } else {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression
                + " (expected 5 or 6 fields, got " + fields + ")");
        }
        try {
            CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression, e);
        }
        return normalized;
    }

    void tick(String projectId, String scheduleId, String targetId, String name) {
        try {
            log.info("Schedule triggered: id={}, name={}", scheduleId, name);
            TargetResolution resolution = Futures.await(targetResolver.resolve(projectId, targetId));

            List<String> fileIds;
            BatchConfig base;
            if (resolution instanceof TargetResolution.SuiteTarget suite) {
                fileIds = suite.fileIds();
                base = suite.config();
            } else if (resolution instanceof TargetResolution.SingleFileTarget single) {
                fileIds = List.of(single.fileId());
                base = new BatchConfig().withName(name);
            } else {
                TargetResolution.NotFound notFound = (TargetResolution.NotFound) resolution;
                log.warn("Schedule target not found: scheduleId={}, targetId={}, reason={}",
                    scheduleId, targetId, notFound.reason());
                return;
            }

            BatchConfig batchConfig = base
                .withSource(RunSource.SCHEDULER)
                .withTriggeredBy(SCHEDULER_TRIGGER)
                .withScheduleId(scheduleId);
            BatchHandle handle = orchestrator.executeBatch(projectId, fileIds, batchConfig);
            log.info("Scheduled batch dispatched: scheduleId={}, runId={}, status={}",
                scheduleId, handle.getRunId(), handle.getStatus());
        } catch (RuntimeException e) {
            log.error("Schedule tick failed: scheduleId={}", scheduleId, e);
        }
    }

    private boolean tryRegister(Schedule schedule) {
        try {
            register(schedule, trigger(schedule.getCronExpression()));
            return true;
        } catch (IllegalArgumentException e) {
            log.error("Invalid cron for schedule {}, skipped: {}", schedule.getId(), e.getMessage());
            return false;
        }
    }

    private void register(Schedule schedule, CronTrigger trigger) {
        String projectId = schedule.getProjectId();
        String scheduleId = schedule.getId();
        String targetId = schedule.getTargetId();
        String name = schedule.displayName();
        ScheduledFuture<?> handle = taskScheduler.schedule(() -> tick(projectId, scheduleId, targetId, name), trigger);
        if (handle == null) {
            throw new IllegalStateException("Task scheduler rejected schedule: " + scheduleId);
        }
        handles.register(scheduleId, handle);
    }

    private CronTrigger trigger(String cronExpression) {
        return new CronTrigger(normalizeCron(cronExpression), config.zoneId());
    }

    private Optional<String> findOwnerProject(String scheduleId) {
        for (Project project : projectRegistry.findAll()) {
            try {
                ProjectDocument document = Futures.await(store.read(project.id()));
                if (document.findSchedule(scheduleId).isPresent()) {
                    return Optional.of(project.id());
                }
            } catch (RuntimeException e) {
                log.warn("Skipping unreadable project in schedule lookup: projectId={}, scheduleId={}",
                    project.id(), scheduleId, e);
            }
        }
        return Optional.empty();
    }

    private static ThreadPoolTaskScheduler newTaskScheduler(SchedulerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(config.poolSize());
        scheduler.setThreadNamePrefix("testops-scheduler-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
