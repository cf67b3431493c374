package com.questrail.synop.config;

import com.questrail.synop.observability.NullObservabilitySink;
import com.questrail.synop.observability.SynopObservabilitySink;

import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for a SYNOP codec.
 *
 * <p>The use-90 overrides choose the code range used for visibility (table
 * 4377) and cloud height (table 1677) when an observation carries no code of
 * its own. A value decoded from a telegram always keeps the range it was
 * decoded from; when there is neither a code nor an override the regular
 * range is used.</p>
 */
public record SynopCodecConfig(
    SynopObservabilitySink observabilitySink,
    Boolean visibilityUse90,
    Boolean cloudHeightUse90,
    UnitConverter unitConverter
) {
    public SynopCodecConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(unitConverter, "unitConverter");
    }

    public static SynopCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Boolean> visibilityUse90Override() {
        return Optional.ofNullable(visibilityUse90);
    }

    public Optional<Boolean> cloudHeightUse90Override() {
        return Optional.ofNullable(cloudHeightUse90);
    }

    public static final class Builder {
        private SynopObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Boolean visibilityUse90;
        private Boolean cloudHeightUse90;
        private UnitConverter unitConverter = StandardUnitConverter.INSTANCE;

        public Builder withObservabilitySink(SynopObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withVisibilityUse90(Boolean use90) {
            this.visibilityUse90 = use90;
            return this;
        }

        public Builder withCloudHeightUse90(Boolean use90) {
            this.cloudHeightUse90 = use90;
            return this;
        }

        public Builder withUnitConverter(UnitConverter unitConverter) {
            this.unitConverter = unitConverter;
            return this;
        }

        public SynopCodecConfig build() {
            return new SynopCodecConfig(observabilitySink, visibilityUse90, cloudHeightUse90, unitConverter);
        }
    }
}
