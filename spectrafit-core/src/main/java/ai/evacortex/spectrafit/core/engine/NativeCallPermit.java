/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.engine;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single process-wide permit guarding calls into the fitting routine.
 *
 * <pre>
 *     try (NativeCallPermit.Held ignored = NativeCallPermit.global().acquire()) {
 *         routine.invoke(...);
 *     }
 * </pre>
 *
 * Acquisition is fair, so tasks reach the routine roughly in the order they finished preparing.
 */
public final class NativeCallPermit {

    private static final NativeCallPermit GLOBAL = new NativeCallPermit("fit-routine");

    private final String name;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicLong acquisitions = new AtomicLong();
    private final AtomicLong waitNanos = new AtomicLong();

    private NativeCallPermit(String name) {
        this.name = name;
    }

    public static NativeCallPermit global() {
        return GLOBAL;
    }

    public Held acquire() {
        long start = System.nanoTime();
        lock.lock();
        waitNanos.addAndGet(System.nanoTime() - start);
        acquisitions.incrementAndGet();
        return new Held();
    }

    public String name() {
        return name;
    }

    public boolean isHeld() {
        return lock.isLocked();
    }

    public long acquisitions() {
        return acquisitions.get();
    }

    public long totalWait(TimeUnit unit) {
        return unit.convert(waitNanos.get(), TimeUnit.NANOSECONDS);
    }

    public final class Held implements AutoCloseable {
        private boolean released;

        private Held() {}

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
