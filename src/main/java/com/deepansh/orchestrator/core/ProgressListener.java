package com.deepansh.orchestrator.core;

/**
 * Receives loop progress synchronously; the loop waits for each call to return
 * before continuing, so a listener sees events in generation order.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> { };

    void onProgress(ProgressEvent event);
}
