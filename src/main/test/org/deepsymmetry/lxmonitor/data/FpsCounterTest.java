package org.deepsymmetry.lxmonitor.data;

import org.junit.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class FpsCounterTest {

    private static final long MS = TimeUnit.MILLISECONDS.toNanos(1);

    @Test
    public void countsArrivalsInTheLastSecond() {
        final FpsCounter counter = new FpsCounter();
        for (int i = 0; i < 40; i++) {
            counter.record(i * 25 * MS);
        }
        assertEquals(40.0, counter.fps(975 * MS), 0.0);
    }

    @Test
    public void forgetsOldArrivals() {
        final FpsCounter counter = new FpsCounter();
        counter.record(0);
        counter.record(500 * MS);
        assertEquals(1.0, counter.fps(1200 * MS), 0.0);
        assertEquals(0.0, counter.fps(3000 * MS), 0.0);
    }
}
