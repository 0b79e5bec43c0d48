package com.gatekeeper.dispatch.cli;

import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;

/**
 * CLI command: gatekeeper tag [name [commit]] [-f] | -d name
 */
@Command(name = "tag", mixinStandardHelpOptions = true, description = "List, create or delete tags")
@Component
public class TagCommand extends RepositoryCommand {

    @Parameters(index = "0", arity = "0..1", description = "Tag name")
    private String name;

    @Parameters(index = "1", arity = "0..1", description = "Commit to tag (default: current head)")
    private String commitId;

    @Option(names = {"--force", "-f"}, description = "Move an existing tag")
    private boolean force;

    @Option(names = "-d", description = "Delete a tag")
    private String delete;

    public TagCommand(HistoryStore store, RepositorySnapshotCodec codec) {
        super(store, codec);
    }

    @Override
    protected boolean execute() {
        if (delete != null) {
            store.deleteTag(delete);
            ConsoleOutput.success("Deleted tag " + delete);
            return true;
        }
        if (name != null) {
            store.createTag(name, commitId, force);
            ConsoleOutput.success("Tagged " + store.getTags().get(name).substring(0, 7) + " as " + name);
            return true;
        }

        Map<String, String> tags = store.getTags();
        if (tags.isEmpty()) {
            ConsoleOutput.info("No tags.");
        }
        tags.forEach((tag, id) -> System.out.printf("  %-20s %s%n", tag, id));
        return false;
    }
}
