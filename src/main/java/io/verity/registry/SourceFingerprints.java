package io.verity.registry;

import io.verity.model.SourceRef;
import io.verity.util.Hashing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class SourceFingerprints {
    public static final String MISSING = "missing";

    private SourceFingerprints() {
    }

    /**
     * SHA-256 of the referenced file, or of the selected line range joined
     * with {@code \n}. A file that does not exist fingerprints as {@link #MISSING}.
     */
    public static String fingerprint(Path projectDir, SourceRef ref) {
        Path file = projectDir.resolve(ref.path()).normalize();
        if (!Files.isRegularFile(file)) {
            return MISSING;
        }
        try {
            if (!ref.ranged()) {
                return Hashing.sha256Hex(Files.readAllBytes(file));
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            int start = ref.startLine() == null ? 1 : Math.max(1, ref.startLine());
            int end = ref.endLine() == null ? lines.size() : Math.min(lines.size(), ref.endLine());
            if (start > end) {
                return Hashing.sha256Hex("");
            }
            return Hashing.sha256Hex(String.join("\n", lines.subList(start - 1, end)));
        } catch (IOException e) {
            throw new RuntimeException("Failed to fingerprint source: " + file, e);
        }
    }
}
