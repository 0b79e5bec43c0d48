package com.gatekeeper.history;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "gatekeeper.history")
public class HistoryProperties {

    private String repositoryName = "gatekeeper-approvals";
    private String defaultBranch = "main";
    /** Branches created with these names are protected from deletion without force. */
    private List<String> protectedBranches = new ArrayList<>(List.of("main", "master"));
    private String authorName = "Gatekeeper";
    private String authorEmail = "gatekeeper@localhost";
    /** Commit every resolved approval decision to the current branch. */
    private boolean recordDecisions = true;

    public String getRepositoryName() { return repositoryName; }
    public void setRepositoryName(String repositoryName) { this.repositoryName = repositoryName; }
    public String getDefaultBranch() { return defaultBranch; }
    public void setDefaultBranch(String defaultBranch) { this.defaultBranch = defaultBranch; }
    public List<String> getProtectedBranches() { return protectedBranches; }
    public void setProtectedBranches(List<String> protectedBranches) { this.protectedBranches = protectedBranches; }
    public String getAuthorName() { return authorName; }
    public void setAuthorName(String authorName) { this.authorName = authorName; }
    public String getAuthorEmail() { return authorEmail; }
    public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
    public boolean isRecordDecisions() { return recordDecisions; }
    public void setRecordDecisions(boolean recordDecisions) { this.recordDecisions = recordDecisions; }
}
