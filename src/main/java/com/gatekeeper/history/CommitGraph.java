package com.gatekeeper.history;

import com.gatekeeper.history.model.Commit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Breadth-first walks over parent links in an id-indexed commit map.
 * Nothing is memoised; each call walks from scratch, which is fine for shallow histories.
 */
final class CommitGraph {

    private CommitGraph() {}

    /**
     * The start commit followed by its ancestors in breadth-first order. Ids missing from
     * {@code commits} are included but not expanded.
     */
    static Set<String> ancestors(String start, Map<String, Commit> commits) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            Commit commit = commits.get(current);
            if (commit != null) {
                queue.addAll(commit.parentIds());
            }
        }
        return visited;
    }

    /**
     * First id in the breadth-first walk from {@code a} that also appears in the walk from {@code b}.
     */
    static Optional<String> findCommonAncestor(String a, String b, Map<String, Commit> commits) {
        Set<String> fromB = ancestors(b, commits);
        for (String id : ancestors(a, commits)) {
            if (fromB.contains(id)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    /**
     * Commits reachable from {@code head} without passing through {@code base}, oldest first.
     */
    static List<String> commitsBetween(String base, String head, Map<String, Commit> commits) {
        if (base == null || head == null) {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(head);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(base) || !visited.add(current)) {
                continue;
            }
            found.add(current);
            Commit commit = commits.get(current);
            if (commit != null) {
                queue.addAll(commit.parentIds());
            }
        }
        Collections.reverse(found);
        return found;
    }

    /**
     * The chain from the root to {@code head} following first parents only, oldest first.
     */
    static List<String> firstParentChain(String head, Map<String, Commit> commits) {
        List<String> chain = new ArrayList<>();
        String current = head;
        while (current != null && !chain.contains(current)) {
            chain.add(current);
            Commit commit = commits.get(current);
            current = commit != null && !commit.parentIds().isEmpty() ? commit.parentIds().get(0) : null;
        }
        Collections.reverse(chain);
        return chain;
    }
}
