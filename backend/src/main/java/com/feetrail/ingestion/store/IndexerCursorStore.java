package com.feetrail.ingestion.store;

import com.feetrail.domain.IndexerState;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.OptionalLong;

/**
 * Persisted indexer cursor. Writes use $max so a stale writer can never move the cursor backwards.
 */
@Service
@RequiredArgsConstructor
public class IndexerCursorStore {

    private final MongoTemplate mongoTemplate;

    public OptionalLong getCursor() {
        IndexerState state = mongoTemplate.findById(IndexerState.FEE_INDEXER_ID, IndexerState.class);
        if (state == null || state.getLastProcessedBlock() == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(state.getLastProcessedBlock());
    }

    public void setCursor(long block) {
        Query query = Query.query(Criteria.where("_id").is(IndexerState.FEE_INDEXER_ID));
        Update update = new Update()
                .max("lastProcessedBlock", block)
                .set("updatedAt", Instant.now());
        mongoTemplate.upsert(query, update, IndexerState.class);
    }
}
