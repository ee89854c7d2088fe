package io.verity.issues;

import io.verity.model.Issue;
import io.verity.util.AtomicFiles;
import io.verity.util.Jsons;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One JSON document per issue under {@code issues/}.
 */
public final class IssueStore {
    private static final String ID_PATTERN = "[A-Za-z0-9_.-]+";

    private final Path dir;

    public IssueStore(Path dir) {
        this.dir = dir;
    }

    public void save(Issue issue) {
        try {
            AtomicFiles.writeJson(fileOf(issue.id()), issue);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write issue: " + issue.id(), e);
        }
    }

    public Optional<Issue> find(String issueId) {
        if (issueId == null || issueId.isBlank()) {
            return Optional.empty();
        }
        Path file = fileOf(issueId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.read(file, Issue.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read issue: " + issueId, e);
        }
    }

    /**
     * True when the issue's document exists and parses.
     */
    public boolean intact(String issueId) {
        if (issueId == null || !issueId.matches(ID_PATTERN)) {
            return false;
        }
        Path file = fileOf(issueId);
        if (!Files.isRegularFile(file)) {
            return false;
        }
        try {
            Jsons.read(file, Issue.class);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public List<Issue> list() {
        List<Issue> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : stream) {
                try {
                    out.add(Jsons.read(file, Issue.class));
                } catch (IOException e) {
                    System.err.println("WARN skipping unreadable issue file " + file.getFileName() + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list issues in " + dir, e);
        }
        out.sort(Comparator.comparingLong(Issue::createdAtMs).thenComparing(Issue::id));
        return out;
    }

    private Path fileOf(String issueId) {
        if (!issueId.matches(ID_PATTERN)) {
            throw new IllegalArgumentException("Invalid issue id: " + issueId);
        }
        return dir.resolve(issueId + ".json");
    }
}
