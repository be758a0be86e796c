package io.holdings.budget;

/**
 * Budget governs access to an upstream service shared by concurrent callers.
 */
public interface Budget extends AutoCloseable {
    /**
     * Block until one external operation may start. The returned permit must be closed when the
     * operation ends, successful or not.
     */
    Permit acquireExternalOp() throws InterruptedException;

    /** Operations currently holding a permit. */
    int inFlight();

    /** A held slot; closing it more than once is harmless. */
    interface Permit extends AutoCloseable {
        @Override
        void close();
    }

    @Override
    default void close() {}
}
