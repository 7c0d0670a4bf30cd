package com.ryuqq.jobpool.application.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 프로세스 기본 JobEngine 보관소.
 *
 * <p>엔진은 명시적으로 생성해 호출자에게 전달하는 것이 원칙입니다. 이 클래스는 꼭 필요한 경우를 위한
 * 단 하나의 기본 인스턴스를 보관할 뿐이며, 임의의 스레드에서 처음 사용될 때 엔진을 만들어 내지 않습니다.</p>
 *
 * <pre>
 * JobEngine engine = WorkerPool.start(new WorkerPoolConfig());
 * JobEngines.install(engine);
 * ...
 * JobEngines.get().submit(job, callbacks);
 * </pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public final class JobEngines {

    private static final Logger log = LoggerFactory.getLogger(JobEngines.class);
    private static final AtomicReference<JobEngine> DEFAULT = new AtomicReference<>();

    private JobEngines() {
    }

    /**
     * 기본 엔진 설치.
     *
     * @param engine 설치할 엔진
     * @throws IllegalArgumentException engine이 null인 경우
     * @throws IllegalStateException 이미 설치된 엔진이 있는 경우
     */
    public static void install(JobEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (!DEFAULT.compareAndSet(null, engine)) {
            throw new IllegalStateException("default JobEngine is already installed");
        }
        log.info("Default JobEngine installed: {}", engine.getClass().getSimpleName());
    }

    /**
     * 기본 엔진 조회.
     *
     * @return 설치된 엔진
     * @throws IllegalStateException 설치된 엔진이 없는 경우
     */
    public static JobEngine get() {
        JobEngine engine = DEFAULT.get();
        if (engine == null) {
            throw new IllegalStateException("no default JobEngine installed; call JobEngines.install(engine) first");
        }
        return engine;
    }

    /**
     * 기본 엔진 조회 (없으면 empty).
     */
    public static Optional<JobEngine> find() {
        return Optional.ofNullable(DEFAULT.get());
    }

    /**
     * 기본 엔진 제거. 엔진을 종료하지는 않습니다.
     *
     * @return 제거된 엔진 (없었으면 empty)
     */
    public static Optional<JobEngine> uninstall() {
        JobEngine previous = DEFAULT.getAndSet(null);
        if (previous != null) {
            log.info("Default JobEngine uninstalled");
        }
        return Optional.ofNullable(previous);
    }
}
