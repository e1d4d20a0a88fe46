package com.medica.factory.optimizer;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> { };

    void onProgress(ProgressEvent event);
}
