package agentswarm.coordinator.scheduler;

import agentswarm.coordinator.model.KillReason;

import java.time.Instant;
import java.util.List;

/**
 * What one reaper sweep saw and did.
 *
 * @param at        sweep start time
 * @param listFailed true if the resource list could not be fetched and nothing was evaluated
 * @param live      resources evaluated and left running
 * @param ignored   ids of live resources whose name is not a session resource name
 * @param skipped   ids of resources not evaluated this cycle because the registry failed
 * @param reclaimed resources reclaimed this cycle
 */
public record SweepReport(
        Instant at,
        boolean listFailed,
        int live,
        List<String> ignored,
        List<String> skipped,
        List<Reclamation> reclaimed) {

    public record Reclamation(String resourceId, String sessionId, KillReason reason, boolean stopped) {
    }

    public SweepReport {
        ignored = List.copyOf(ignored);
        skipped = List.copyOf(skipped);
        reclaimed = List.copyOf(reclaimed);
    }

    static SweepReport listFailed(Instant at) {
        return new SweepReport(at, true, 0, List.of(), List.of(), List.of());
    }

    static SweepReport empty(Instant at) {
        return new SweepReport(at, false, 0, List.of(), List.of(), List.of());
    }

    /** Resources matched to a session this cycle. */
    public int evaluated() {
        return live + skipped.size() + reclaimed.size();
    }
}
