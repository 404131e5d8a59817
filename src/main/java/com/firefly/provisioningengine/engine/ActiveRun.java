package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.events.ProgressChannel;
import reactor.core.Disposable;

/** A run together with its progress channel and the subscription driving it. */
public final class ActiveRun {
    private final RunState state;
    private final ProgressChannel channel;
    private volatile Disposable execution;

    ActiveRun(RunState state, ProgressChannel channel) {
        this.state = state;
        this.channel = channel;
    }

    public RunState state() { return state; }

    public ProgressChannel channel() { return channel; }

    void attach(Disposable execution) {
        this.execution = execution;
    }

    void dispose() {
        Disposable d = execution;
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
