package io.github.eutro.jbitcode.core.ops;

public enum SyncScope {
    SINGLE_THREAD,
    CROSS_THREAD,
}
