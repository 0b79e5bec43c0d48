package com.gatekeeper.dispatch.cli;

import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.model.Branch;
import com.gatekeeper.history.model.BranchFilter;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: gatekeeper branch [name [base]] | -d name | -D name | --protect name
 */
@Command(name = "branch", mixinStandardHelpOptions = true, description = "List, create, delete or protect branches")
@Component
public class BranchCommand extends RepositoryCommand {

    @Parameters(index = "0", arity = "0..1", description = "Branch to create")
    private String name;

    @Parameters(index = "1", arity = "0..1", description = "Base commit (default: current head)")
    private String base;

    @Option(names = "-d", description = "Delete a merged branch")
    private String delete;

    @Option(names = "-D", description = "Delete a branch even if unmerged or protected")
    private String forceDelete;

    @Option(names = "--protect", description = "Protect a branch from deletion")
    private String protect;

    @Option(names = "--unprotect", description = "Remove deletion protection")
    private String unprotect;

    @Option(names = "--merged", description = "List only branches merged into the default branch")
    private boolean merged;

    public BranchCommand(HistoryStore store, RepositorySnapshotCodec codec) {
        super(store, codec);
    }

    @Override
    protected boolean execute() {
        if (delete != null || forceDelete != null) {
            boolean force = forceDelete != null;
            String target = force ? forceDelete : delete;
            store.deleteBranch(target, force);
            ConsoleOutput.success("Deleted branch " + target);
            return true;
        }
        if (protect != null) {
            store.protectBranch(protect, true);
            ConsoleOutput.success("Protected branch " + protect);
            return true;
        }
        if (unprotect != null) {
            store.protectBranch(unprotect, false);
            ConsoleOutput.success("Unprotected branch " + unprotect);
            return true;
        }
        if (name != null) {
            Branch created = store.createBranch(name, base);
            ConsoleOutput.success("Created branch " + created.name()
                    + (created.head() != null ? " at " + created.head().substring(0, 7) : ""));
            return true;
        }

        List<Branch> branches = store.listBranches(merged ? BranchFilter.merged() : BranchFilter.all());
        String current = store.getCurrentBranch().name();
        for (Branch branch : branches) {
            String head = branch.head() != null ? branch.head().substring(0, 7) : "(empty)";
            String detail = head + " " + branch.path().size() + " commits" + (branch.protectedBranch() ? " [protected]" : "");
            ConsoleOutput.branch(branch.name(), branch.name().equals(current), detail);
        }
        return false;
    }
}
