package com.example.autopilot.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted trace of a batch that has not yet been consumed by a decision. Members are referenced
 * by dedup key so the batch can be rebuilt from history after a restart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenBatchMarker implements Serializable {

    private String batchId;
    private List<String> messageKeys;
    private Instant openedAt;
    private Instant lastExtendedAt;
    private boolean closed;

    public static OpenBatchMarker of(Batch batch) {
        return OpenBatchMarker.builder()
                .batchId(batch.getId())
                .messageKeys(batch.getMessages().stream().map(Message::getDedupKey).toList())
                .openedAt(batch.getOpenedAt())
                .lastExtendedAt(batch.getLastExtendedAt())
                .closed(batch.isClosed())
                .build();
    }
}
