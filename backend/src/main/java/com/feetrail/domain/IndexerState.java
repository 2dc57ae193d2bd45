package com.feetrail.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persisted indexer cursor: last fully indexed block. Never decreases.
 */
@Document(collection = "indexer_state")
@NoArgsConstructor
@Getter
@Setter
public class IndexerState {

    public static final String FEE_INDEXER_ID = "fee-indexer";

    @Id
    private String id;
    private Long lastProcessedBlock;
    private Instant updatedAt;
}
