package com.mailmind.dispatch;

/**
 * Receives batch progress, once per finished item, on the thread that called
 * {@link BatchDispatcher#processBatch}.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int done, int total);
}
