package com.gatekeeper.core.policy;

import com.gatekeeper.core.model.TaskContext;

/**
 * Maps a task to an approval category. Replaceable: the default is a keyword heuristic.
 */
@FunctionalInterface
public interface CategoryClassifier {

    CategorySuggestion classify(TaskContext context);
}
