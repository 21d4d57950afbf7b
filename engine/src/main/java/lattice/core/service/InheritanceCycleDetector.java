package lattice.core.service;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Detects whether new parent edges would introduce a cycle into an inheritance graph.
 *
 * <p>The same routine serves the role graph and the permission graph; each caller
 * supplies a lookup from entity ID to its current parent IDs. For every candidate
 * parent a depth-first walk follows existing parent edges; reaching the child means
 * the edge would make the child its own ancestor. Each candidate is walked with its
 * own visited set so that nodes seen for one candidate never hide a cycle through another.
 *
 * <p>The walk uses an explicit stack. Callers must hold whatever lock keeps the
 * graph stable for the duration of the check.
 */
public final class InheritanceCycleDetector {

    private InheritanceCycleDetector() {}

    /**
     * Find the first candidate parent that would create a cycle.
     *
     * @param entityId           the entity gaining parents
     * @param candidateParentIds the parents to check
     * @param parentsOf          current parent IDs of an entity; empty for unknown IDs
     * @return the offending parent, or empty if every candidate is safe
     */
    public static Optional<String> findCyclicParent(
            String entityId, Collection<String> candidateParentIds, Function<String, List<String>> parentsOf) {
        for (final var candidate : candidateParentIds) {
            if (reaches(candidate, entityId, parentsOf)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Check whether any of the candidate parents would create a cycle.
     */
    public static boolean createsCycle(
            String entityId, Collection<String> candidateParentIds, Function<String, List<String>> parentsOf) {
        return findCyclicParent(entityId, candidateParentIds, parentsOf).isPresent();
    }

    private static boolean reaches(String start, String target, Function<String, List<String>> parentsOf) {
        final var visited = new HashSet<String>();
        final var stack = new ArrayDeque<String>();
        stack.push(start);

        while (!stack.isEmpty()) {
            final var current = stack.pop();
            if (current.equals(target)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (final var parentId : parentsOf.apply(current)) {
                if (!visited.contains(parentId)) {
                    stack.push(parentId);
                }
            }
        }
        return false;
    }
}
