package com.gatekeeper.dispatch.cli;

import com.gatekeeper.core.error.GatekeeperException;
import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base for subcommands that work on the approval history file.
 * <p>
 * Loads the snapshot named by {@code --repo} into the {@link HistoryStore}, runs the command,
 * and writes the snapshot back only when the command changed something and succeeded.
 * A failing command prints the error, leaves the file untouched, and exits with 1.
 */
abstract class RepositoryCommand implements Callable<Integer> {

    static final int EXIT_FAILURE = 1;

    @ParentCommand
    private GatekeeperCommand parent;

    protected final HistoryStore store;
    private final RepositorySnapshotCodec codec;

    protected RepositoryCommand(HistoryStore store, RepositorySnapshotCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @Override
    public Integer call() {
        Path repo = repoPath();
        try {
            codec.read(repo).ifPresent(store::importRepository);
            boolean changed = execute();
            if (changed) {
                codec.write(repo, store.exportRepository());
            }
            return 0;
        } catch (GatekeeperException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid argument: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * @return true when the repository was modified and should be saved
     */
    protected abstract boolean execute();

    Path repoPath() {
        return parent != null ? parent.repo() : Path.of(GatekeeperCommand.DEFAULT_REPO);
    }
}
