package com.debtchecker.service;

import com.debtchecker.model.Progress;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    /** Called from worker threads after every recorded outcome. */
    void onProgress(Progress progress);
}
