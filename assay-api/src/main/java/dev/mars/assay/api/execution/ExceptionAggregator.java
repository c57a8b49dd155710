/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.assay.api.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collects exceptions raised while running a test so they can be reported together.
 * Safe for use from multiple threads.
 */
public class ExceptionAggregator {

    private final List<Throwable> exceptions = Collections.synchronizedList(new ArrayList<>());

    public void add(Throwable throwable) {
        exceptions.add(Objects.requireNonNull(throwable, "Throwable cannot be null"));
    }

    /**
     * Runs the code, recording anything it throws instead of propagating it.
     */
    public void run(Runnable code) {
        try {
            code.run();
        } catch (RuntimeException | Error e) {
            add(e);
        }
    }

    public boolean hasExceptions() {
        return !exceptions.isEmpty();
    }

    public List<Throwable> getExceptions() {
        synchronized (exceptions) {
            return List.copyOf(exceptions);
        }
    }

    /**
     * @return null when nothing was recorded, the single exception when one was, otherwise the
     *         first exception with the rest attached as suppressed
     */
    public Throwable toException() {
        List<Throwable> snapshot = getExceptions();
        if (snapshot.isEmpty()) {
            return null;
        }
        Throwable first = snapshot.get(0);
        for (int i = 1; i < snapshot.size(); i++) {
            first.addSuppressed(snapshot.get(i));
        }
        return first;
    }

    public void clear() {
        exceptions.clear();
    }
}
