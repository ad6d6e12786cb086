package com.hltvsync.application.usecase;

import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.SyncCheckpoint;
import com.hltvsync.domain.model.SyncLimits;
import com.hltvsync.domain.model.UnitOfWork;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory plan of one run. Not thread-safe; the orchestrator serializes access.
 */
final class RunPlan {

    private final SyncLimits limits;
    private final Set<String> planned = new HashSet<>();
    private final Set<String> completed = new HashSet<>();
    private final Map<PageKind, Integer> plannedPerKind = new EnumMap<>(PageKind.class);
    private final List<UnitOfWork> pending = new ArrayList<>();

    RunPlan(SyncLimits limits) {
        this.limits = limits;
    }

    /**
     * Rebuilds the plan of an interrupted run. Units planned before count against the limits.
     */
    static RunPlan resume(SyncCheckpoint checkpoint, SyncLimits limits) {
        RunPlan plan = new RunPlan(limits);
        for (UnitOfWork unit : checkpoint.planned()) {
            if (!plan.planned.add(unit.key())) {
                continue;
            }
            plan.plannedPerKind.merge(unit.pageKind(), 1, Integer::sum);
            if (checkpoint.completed().contains(unit.key())) {
                plan.completed.add(unit.key());
            } else {
                plan.pending.add(unit);
            }
        }
        return plan;
    }

    /**
     * Adds the candidates not planned yet, in order, until the kind's limit is reached.
     *
     * @return the units actually added
     */
    List<UnitOfWork> admit(List<UnitOfWork> candidates) {
        List<UnitOfWork> admitted = new ArrayList<>();
        for (UnitOfWork unit : candidates) {
            if (planned.contains(unit.key())) {
                continue;
            }
            int limit = limits.limitFor(unit.pageKind());
            int count = plannedPerKind.getOrDefault(unit.pageKind(), 0);
            if (limit > 0 && count >= limit) {
                continue;
            }
            planned.add(unit.key());
            plannedPerKind.put(unit.pageKind(), count + 1);
            pending.add(unit);
            admitted.add(unit);
        }
        return admitted;
    }

    /**
     * Removes and returns the pending units of the lowest level, in plan order.
     */
    List<UnitOfWork> nextWave() {
        if (pending.isEmpty()) {
            return List.of();
        }
        int level = pending.stream().mapToInt(UnitOfWork::level).min().getAsInt();
        List<UnitOfWork> wave = pending.stream().filter(unit -> unit.level() == level).toList();
        pending.removeAll(wave);
        return wave;
    }

    void complete(UnitOfWork unit) {
        completed.add(unit.key());
    }

    int completedCount() {
        return completed.size();
    }
}
