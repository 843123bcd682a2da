package me.golemcore.contextmem.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides when buffered state should be written out: after a number of pending
 * events or once the flush interval has elapsed, whichever comes first.
 */
public class FlushPolicy {

    private final int eventThreshold;
    private final Duration interval;
    private final Clock clock;

    private int pendingEvents;
    private Instant lastFlush;

    public FlushPolicy(int eventThreshold, Duration interval, Clock clock) {
        if (eventThreshold < 1) {
            throw new IllegalArgumentException("eventThreshold must be positive, got " + eventThreshold);
        }
        this.eventThreshold = eventThreshold;
        this.interval = interval;
        this.clock = clock;
        this.lastFlush = clock.instant();
    }

    /**
     * Registers one state change.
     *
     * @return true if the caller should flush now
     */
    public boolean recordEvent() {
        pendingEvents++;
        return shouldFlush();
    }

    public boolean shouldFlush() {
        if (pendingEvents == 0) {
            return false;
        }
        return pendingEvents >= eventThreshold || !clock.instant().isBefore(lastFlush.plus(interval));
    }

    public void markFlushed() {
        pendingEvents = 0;
        lastFlush = clock.instant();
    }

    public int getPendingEvents() {
        return pendingEvents;
    }

    public Instant getLastFlush() {
        return lastFlush;
    }
}
