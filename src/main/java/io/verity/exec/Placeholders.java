package io.verity.exec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values substituted into check and step commands. Only {@code {site}},
 * {@code {target}}, {@code {root}} and {@code {run_id}} are recognized; any
 * other braces are left untouched.
 */
public record Placeholders(String site, String target, String root, String runId) {
    public Placeholders {
        site = site == null ? "" : site;
        target = target == null ? "" : target;
        root = root == null ? "" : root;
        runId = runId == null ? "" : runId;
    }

    public static Placeholders none() {
        return new Placeholders("", "", "", "");
    }

    public String apply(String command) {
        if (command == null || command.indexOf('{') < 0) {
            return command;
        }
        String out = command;
        for (Map.Entry<String, String> e : values().entrySet()) {
            out = out.replace(e.getKey(), e.getValue());
        }
        return out;
    }

    public Placeholders withRunId(String value) {
        return new Placeholders(site, target, root, value);
    }

    private Map<String, String> values() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("{site}", site);
        out.put("{target}", target);
        out.put("{root}", root);
        out.put("{run_id}", runId);
        return out;
    }
}
