package org.tarik.resilience.error;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

import static java.util.Optional.ofNullable;

/**
 * Closed hierarchy of failure kinds raised by the platform.
 * A retryable set lists kinds; a failure matches an entry if its kind is the entry itself or one of its
 * descendants.
 */
public enum FailureKind {
    /**
     * Root of the hierarchy. Listing it in a retryable set matches every classified failure.
     */
    PLATFORM(null),

    /**
     * Missing or invalid setup (properties, environment variables, API keys).
     * Retry: NO
     */
    CONFIGURATION(PLATFORM),

    /**
     * Malformed input passed to the platform.
     * Retry: NO
     */
    VALIDATION(PLATFORM),

    DATA_SOURCE(PLATFORM),

    /**
     * Retrieval of external data failed (crawler, market data endpoint).
     * Retry: YES
     */
    DATA_FETCH(DATA_SOURCE),

    /**
     * Retrieved data could not be parsed.
     * Retry: NO
     */
    DATA_PARSE(DATA_SOURCE),

    /**
     * Transport-level failure of an external API call.
     * Retry: YES
     */
    API(PLATFORM),
    API_TIMEOUT(API),
    API_RATE_LIMIT(API),

    MODEL(PLATFORM),

    /**
     * The language model returned an empty, truncated or otherwise unusable response.
     * Retry: YES
     */
    MODEL_RESPONSE(MODEL),

    /**
     * The language model output could not be parsed into the expected structure.
     * Retry: OPTIONAL (a new sample may parse)
     */
    MODEL_PARSE(MODEL),

    AGENT(PLATFORM),
    AGENT_TIMEOUT(AGENT),

    TOOL(PLATFORM),
    TOOL_NOT_FOUND(TOOL),

    MARKET(PLATFORM),
    INVALID_MARKET(MARKET),
    INVALID_SYMBOL(MARKET),

    SIGNAL_PARSE(PLATFORM),
    FACTOR_PARSE(PLATFORM);

    private final FailureKind parent;

    FailureKind(@Nullable FailureKind parent) {
        this.parent = parent;
    }

    public Optional<FailureKind> getParent() {
        return ofNullable(parent);
    }

    /**
     * Checks whether this kind is the given kind or one of its descendants.
     *
     * @param other the kind to check membership against
     * @return {@code true} if {@code other} is this kind or one of its ancestors
     */
    public boolean isA(FailureKind other) {
        for (FailureKind current = this; current != null; current = current.parent) {
            if (current == other) {
                return true;
            }
        }
        return false;
    }
}
