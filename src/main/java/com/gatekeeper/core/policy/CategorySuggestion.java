package com.gatekeeper.core.policy;

import com.gatekeeper.core.model.ApprovalCategory;

import java.util.List;
import java.util.Optional;

/**
 * A classifier's guess at the category and theme of a task.
 *
 * @param category        suggested category, empty when nothing matched
 * @param themeId         the theme the request should be filed under, {@code "unknown"} when none
 * @param confidence      0.0 - 1.0
 * @param matchedKeywords keywords that triggered the suggestion
 */
public record CategorySuggestion(
    Optional<ApprovalCategory> category,
    String themeId,
    double confidence,
    List<String> matchedKeywords
) {

    public static final String UNKNOWN_THEME = "unknown";

    public static CategorySuggestion none() {
        return new CategorySuggestion(Optional.empty(), UNKNOWN_THEME, 0.0, List.of());
    }
}
