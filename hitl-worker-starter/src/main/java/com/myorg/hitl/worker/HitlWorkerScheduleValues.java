package com.myorg.hitl.worker;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class HitlWorkerScheduleValues {
    private final HitlWorkerProperties props;

    public long getReaperIntervalMs() { return props.getReaper().getInterval().toMillis(); }
    public long getReaperInitialDelayMs() { return props.getReaper().getInitialDelay().toMillis(); }
}
