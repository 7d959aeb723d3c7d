package io.failforge.internal;

/**
 * Rethrows any throwable without wrapping, checked ones included.
 */
public final class Throwables {

    private Throwables() {
    }

    public static RuntimeException rethrow(Throwable throwable) {
        Throwables.<RuntimeException>sneakyThrow(throwable);
        return null;
    }

    @SuppressWarnings("unchecked")
    private static <T extends Throwable> void sneakyThrow(Throwable throwable) throws T {
        throw (T) throwable;
    }
}
