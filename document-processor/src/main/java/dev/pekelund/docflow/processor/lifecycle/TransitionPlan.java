package dev.pekelund.docflow.processor.lifecycle;

import dev.pekelund.docflow.model.RecordStatus;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Mutations required by one lifecycle transition.
 *
 * @param transition short name used in logs and result details
 * @param recordId working record the transition applies to, {@code null} for plans on other tables
 * @param expectedStatuses statuses the working record must still have when the plan is applied; empty to skip
 *     the check
 * @param mutations changes in planning order
 */
public record TransitionPlan(
    String transition,
    String recordId,
    Set<RecordStatus> expectedStatuses,
    List<StoreMutation> mutations
) {

    public TransitionPlan {
        expectedStatuses = Set.copyOf(expectedStatuses);
        mutations = List.copyOf(mutations);
    }

    /**
     * @return the mutations ordered by phase, keeping planning order within a phase
     */
    public List<StoreMutation> orderedMutations() {
        return mutations.stream().sorted(Comparator.comparing(StoreMutation::phase)).toList();
    }

    public boolean hasPrecondition() {
        return recordId != null && !expectedStatuses.isEmpty();
    }
}
