package com.example.autopilot.service;

import com.example.autopilot.domain.Batch;

@FunctionalInterface
public interface BatchHandler {

    void onBatchClosed(Batch batch);
}
