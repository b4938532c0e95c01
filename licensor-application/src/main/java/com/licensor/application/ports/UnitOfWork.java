package com.licensor.application.ports;

import java.util.function.Supplier;

/**
 * Transaction boundary. Everything the work does through {@link LicenseRepository} commits
 * together or not at all; any exception thrown by the work rolls back and is rethrown unchanged.
 */
public interface UnitOfWork {

    <T> T execute(Supplier<T> work);

    default void run(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }
}
