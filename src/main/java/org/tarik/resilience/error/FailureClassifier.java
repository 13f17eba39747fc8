package org.tarik.resilience.error;

import java.util.Optional;

/**
 * Maps a caught failure to its {@link FailureKind}.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * @return the kind of the failure, or empty if the failure doesn't belong to the platform taxonomy
     */
    Optional<FailureKind> classify(Throwable failure);
}
