package io.github.eutro.jbitcode.core.ops;

public enum ThreadLocalMode {
    NOT_THREAD_LOCAL(""),
    GENERAL_DYNAMIC("thread_local"),
    LOCAL_DYNAMIC("thread_local(localdynamic)"),
    INITIAL_EXEC("thread_local(initialexec)"),
    LOCAL_EXEC("thread_local(localexec)"),
    ;

    public final String mnemonic;

    ThreadLocalMode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
