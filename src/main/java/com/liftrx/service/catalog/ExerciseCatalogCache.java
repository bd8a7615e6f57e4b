package com.liftrx.service.catalog;

import com.liftrx.config.PrescriptionProperties;
import com.liftrx.model.domain.ExerciseCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 动作库进程内缓存
 * 快照过期或被清除后，下一次 get() 重新加载；并发未命中可能重复加载，以最后一次写入为准
 */
@Slf4j
@Component
public class ExerciseCatalogCache {

    private final ExerciseCatalogLoader loader;
    private final Clock clock;
    private final Duration ttl;

    private volatile ExerciseCatalog snapshot;

    public ExerciseCatalogCache(ExerciseCatalogLoader loader, Clock clock, PrescriptionProperties properties) {
        this.loader = loader;
        this.clock = clock;
        this.ttl = properties.getCatalog().getTtl();
    }

    public ExerciseCatalog get() {
        ExerciseCatalog current = snapshot;
        LocalDateTime now = LocalDateTime.now(clock);
        if (current != null && now.isBefore(current.loadedAt().plus(ttl))) {
            return current;
        }
        log.info("动作库缓存{}，重新加载", current == null ? "为空" : "已过期");
        ExerciseCatalog loaded = new ExerciseCatalog(loader.getAllExercises(), loader.getMuscleNames(), now);
        snapshot = loaded;
        return loaded;
    }

    public void invalidate() {
        snapshot = null;
        log.info("动作库缓存已清除");
    }
}
