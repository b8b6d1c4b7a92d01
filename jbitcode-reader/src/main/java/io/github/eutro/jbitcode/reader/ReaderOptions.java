package io.github.eutro.jbitcode.reader;

/**
 * Settings for a {@link BitcodeReader}.
 *
 * @see #builder()
 */
public final class ReaderOptions {
    /**
     * Set to anything but {@code false} to record where every placeholder was created.
     */
    public static final String TRACK_PLACEHOLDERS_ENV = "JBITCODE_TRACK_PLACEHOLDERS";

    public static final ReaderOptions DEFAULT = builder().build();

    private final boolean lazy;
    private final boolean eagerInlineWhenSafe;
    private final boolean upgradeIntrinsics;
    private final boolean trackPlaceholders;

    private ReaderOptions(Builder builder) {
        this.lazy = builder.lazy;
        this.eagerInlineWhenSafe = builder.eagerInlineWhenSafe;
        this.upgradeIntrinsics = builder.upgradeIntrinsics;
        this.trackPlaceholders = builder.trackPlaceholders;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether function bodies are left unread until they are materialized.
     *
     * @return Whether reading is lazy.
     */
    public boolean isLazy() {
        return lazy;
    }

    /**
     * Whether, when not lazy, a function body may be decoded as soon as it is seen,
     * once the buffer is complete and the module symbol table has been read.
     *
     * @return Whether bodies are decoded in place.
     */
    public boolean isEagerInlineWhenSafe() {
        return eagerInlineWhenSafe;
    }

    public boolean isUpgradeIntrinsics() {
        return upgradeIntrinsics;
    }

    public boolean isTrackPlaceholders() {
        return trackPlaceholders;
    }

    public Builder toBuilder() {
        return new Builder()
                .lazy(lazy)
                .eagerInlineWhenSafe(eagerInlineWhenSafe)
                .upgradeIntrinsics(upgradeIntrinsics)
                .trackPlaceholders(trackPlaceholders);
    }

    @Override
    public String toString() {
        return "ReaderOptions{lazy=" + lazy
                + ", eagerInlineWhenSafe=" + eagerInlineWhenSafe
                + ", upgradeIntrinsics=" + upgradeIntrinsics
                + ", trackPlaceholders=" + trackPlaceholders
                + "}";
    }

    static boolean trackPlaceholdersFromEnv() {
        String value = System.getenv(TRACK_PLACEHOLDERS_ENV);
        return value != null && !value.isEmpty() && !"false".equalsIgnoreCase(value);
    }

    public static final class Builder {
        private boolean lazy = true;
        private boolean eagerInlineWhenSafe = true;
        private boolean upgradeIntrinsics = true;
        private boolean trackPlaceholders = trackPlaceholdersFromEnv();

        private Builder() {
        }

        public Builder lazy(boolean lazy) {
            this.lazy = lazy;
            return this;
        }

        public Builder eagerInlineWhenSafe(boolean eagerInlineWhenSafe) {
            this.eagerInlineWhenSafe = eagerInlineWhenSafe;
            return this;
        }

        public Builder upgradeIntrinsics(boolean upgradeIntrinsics) {
            this.upgradeIntrinsics = upgradeIntrinsics;
            return this;
        }

        public Builder trackPlaceholders(boolean trackPlaceholders) {
            this.trackPlaceholders = trackPlaceholders;
            return this;
        }

        public ReaderOptions build() {
            return new ReaderOptions(this);
        }
    }
}
