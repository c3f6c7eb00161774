package com.openforge.memoria.process;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Tracks helper OS processes spawned by extraction agents, keyed by pid,
 * so they can be killed when their owning session goes away.
 */
@Slf4j
@Component
public class ProcessRegistry {

    private final Map<Long, TrackedProcess> processes = new ConcurrentHashMap<>();

    public void register(Long sessionDbId, Process process) {
        processes.put(process.pid(), new TrackedProcess(sessionDbId, process));
    }

    public void unregister(Process process) {
        processes.remove(process.pid());
    }

    /** Kill every helper owned by a session. */
    public int killSession(Long sessionDbId) {
        return killMatching(tracked -> tracked.sessionDbId().equals(sessionDbId), "session " + sessionDbId + " stopped");
    }

    /** Kill helpers whose owning session is no longer in {@code liveSessionIds}. */
    public int reapOrphans(Set<Long> liveSessionIds) {
        return killMatching(tracked -> !liveSessionIds.contains(tracked.sessionDbId()), "orphaned");
    }

    public int killAll() {
        return killMatching(tracked -> true, "shutdown");
    }

    public int size() {
        processes.values().removeIf(tracked -> !tracked.process().isAlive());
        return processes.size();
    }

    private int killMatching(Predicate<TrackedProcess> filter, String reason) {
        List<TrackedProcess> victims = processes.values().stream().filter(filter).toList();
        int killed = 0;
        for (TrackedProcess tracked : victims) {
            processes.remove(tracked.process().pid());
            if (tracked.process().isAlive()) {
                tracked.process().destroyForcibly();
                killed++;
                log.info("[Processes] Killed helper pid={} session={} reason={}",
                        tracked.process().pid(), tracked.sessionDbId(), reason);
            }
        }
        return killed;
    }

    private record TrackedProcess(Long sessionDbId, Process process) {}
}
