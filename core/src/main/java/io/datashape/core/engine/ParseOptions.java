package io.datashape.core.engine;

import io.datashape.core.spi.ErrorMap;

/**
 * Call-site options for a single parse. Unset fields fall back to the root schema's options, then
 * to the global configuration.
 *
 * @param abortEarly stop collecting issues after the first one
 * @param debug      log every reported issue at DEBUG level
 * @param errorMap   call-site error map, the highest-priority map layer
 * @param config     global configuration to read defaults from; {@code null} means
 *                   {@link GlobalConfig#shared()}
 */
public record ParseOptions(Boolean abortEarly, Boolean debug, ErrorMap errorMap, GlobalConfig config) {

    public static final ParseOptions DEFAULT = new ParseOptions(null, null, null, null);

    /** Options that stop the parse at the first issue. */
    public static ParseOptions stopAtFirstIssue() {
        return builder().abortEarly(true).build();
    }

    public static ParseOptions ofErrorMap(ErrorMap errorMap) {
        return builder().errorMap(errorMap).build();
    }

    public GlobalConfig resolvedConfig() {
        return config != null ? config : GlobalConfig.shared();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ParseOptions}. */
    public static final class Builder {

        private Boolean abortEarly;
        private Boolean debug;
        private ErrorMap errorMap;
        private GlobalConfig config;

        private Builder() {}

        public Builder abortEarly(boolean value) {
            this.abortEarly = value;
            return this;
        }

        public Builder debug(boolean value) {
            this.debug = value;
            return this;
        }

        public Builder errorMap(ErrorMap map) {
            this.errorMap = map;
            return this;
        }

        public Builder config(GlobalConfig value) {
            this.config = value;
            return this;
        }

        public ParseOptions build() {
            return new ParseOptions(abortEarly, debug, errorMap, config);
        }
    }
}
