package io.jsonlogic.core.config;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Engine configuration. Use {@link #builder()} to construct instances; unset fields receive the
 * defaults below.
 *
 * @param maxDepth              maximum nesting depth of rules and arrays evaluated in one call
 *                              (default 512)
 * @param unknownOperatorPolicy handling of unregistered operators (default {@code FAIL})
 * @param dateZone              zone used by the default date provider for {@code today} and for
 *                              converting offset datetimes (default UTC)
 * @param disabledOperators     built-in operators removed from a new engine's registry (default
 *                              none)
 */
public record EngineConfig(
        int maxDepth, UnknownOperatorPolicy unknownOperatorPolicy, ZoneId dateZone, Set<String> disabledOperators) {

    public static final int DEFAULT_MAX_DEPTH = 512;

    /** Configuration with every field at its default. */
    public static final EngineConfig DEFAULT = builder().build();

    public EngineConfig {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be > 0, got: " + maxDepth);
        }
        Objects.requireNonNull(unknownOperatorPolicy, "unknownOperatorPolicy must not be null");
        Objects.requireNonNull(dateZone, "dateZone must not be null");
        disabledOperators = Set.copyOf(Objects.requireNonNull(disabledOperators, "disabledOperators must not be null"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link EngineConfig}. */
    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private UnknownOperatorPolicy unknownOperatorPolicy = UnknownOperatorPolicy.FAIL;
        private ZoneId dateZone = ZoneOffset.UTC;
        private Set<String> disabledOperators = Set.of();

        Builder() {}

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder unknownOperatorPolicy(UnknownOperatorPolicy unknownOperatorPolicy) {
            this.unknownOperatorPolicy = unknownOperatorPolicy;
            return this;
        }

        public Builder dateZone(ZoneId dateZone) {
            this.dateZone = dateZone;
            return this;
        }

        public Builder disabledOperators(Collection<String> disabledOperators) {
            this.disabledOperators = Set.copyOf(disabledOperators);
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(maxDepth, unknownOperatorPolicy, dateZone, disabledOperators);
        }
    }
}
