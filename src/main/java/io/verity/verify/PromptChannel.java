package io.verity.verify;

import java.util.Optional;

/**
 * Source of answers for the opportunistic prompt.
 */
public interface PromptChannel {
    /**
     * Shows {@code question} and waits at most {@code timeoutSec} seconds.
     *
     * @return the trimmed answer, or empty when no answer arrived in time
     */
    Optional<String> ask(String question, int timeoutSec);
}
