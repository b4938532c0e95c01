package com.licensor.application.ports.impl;

import com.licensor.application.ports.UnitOfWork;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs one unit of work at a time, standing in for the row lock a real store takes.
 */
public final class SerializedUnitOfWork implements UnitOfWork {

    private final ReentrantLock lock = new ReentrantLock(true);

    @Override
    public <T> T execute(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
