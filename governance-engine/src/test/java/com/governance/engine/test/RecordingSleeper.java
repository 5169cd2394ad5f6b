package com.governance.engine.test;

import com.governance.engine.execution.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested backoffs and advances a {@link TimeController} instead of waiting.
 */
public class RecordingSleeper implements Sleeper {

    private final TimeController time;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    public RecordingSleeper(TimeController time) {
        this.time = time;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        time.advance(duration);
    }

    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }
}
