package com.gatekeeper.history.model;

import java.time.Instant;

/**
 * Filters for {@code getLog}. Every field is optional; null means "no restriction".
 *
 * @param branch only commits on this branch's path
 * @param author case-insensitive substring of the author name
 * @param since  inclusive lower bound on the commit timestamp
 * @param until  inclusive upper bound on the commit timestamp
 * @param grep   case-insensitive regex matched against the message
 * @param limit  maximum number of commits; zero or less means unlimited
 */
public record LogFilter(
    String branch,
    String author,
    Instant since,
    Instant until,
    String grep,
    int limit
) {

    public static LogFilter all() {
        return new LogFilter(null, null, null, null, null, 0);
    }

    public LogFilter onBranch(String value) {
        return new LogFilter(value, author, since, until, grep, limit);
    }

    public LogFilter byAuthor(String value) {
        return new LogFilter(branch, value, since, until, grep, limit);
    }

    public LogFilter between(Instant from, Instant to) {
        return new LogFilter(branch, author, from, to, grep, limit);
    }

    public LogFilter matching(String regex) {
        return new LogFilter(branch, author, since, until, regex, limit);
    }

    public LogFilter limitedTo(int value) {
        return new LogFilter(branch, author, since, until, grep, value);
    }
}
