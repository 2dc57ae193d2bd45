package com.feetrail.ingestion.store;

import com.feetrail.domain.FeeDistribution;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Insert-if-absent for fee distributions keyed by (txHash, logIndex). Existing records are never overwritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeeDistributionStore {

    private final MongoTemplate mongoTemplate;

    /**
     * @return true if a new record was created, false if one already existed for the key
     */
    public boolean insertIfAbsent(FeeDistribution record) {
        if (record.getTxHash() == null) {
            throw new IllegalArgumentException("txHash required");
        }
        Query key = Query.query(Criteria.where("txHash").is(record.getTxHash())
                .and("logIndex").is(record.getLogIndex()));
        Update update = new Update()
                .setOnInsert("blockNumber", record.getBlockNumber())
                .setOnInsert("blockTimestamp", record.getBlockTimestamp())
                .setOnInsert("eventType", record.getEventType())
                .setOnInsert("poolId", record.getPoolId())
                .setOnInsert("devAddress", record.getDevAddress())
                .setOnInsert("tokenAddress", record.getTokenAddress())
                .setOnInsert("recipientAddress", record.getRecipientAddress())
                .setOnInsert("amount", record.getAmount())
                .setOnInsert("devAmount", record.getDevAmount())
                .setOnInsert("protocolAmount", record.getProtocolAmount())
                .setOnInsert("projectId", record.getProjectId())
                .setOnInsert("vaultAddress", record.getVaultAddress())
                .setOnInsert("indexedAt", record.getIndexedAt());
        try {
            UpdateResult result = mongoTemplate.upsert(key, update, FeeDistribution.class);
            return result.getUpsertedId() != null;
        } catch (DuplicateKeyException e) {
            // concurrent upsert of the same key lost the race to the unique index
            log.debug("Distribution {}#{} already stored", record.getTxHash(), record.getLogIndex());
            return false;
        }
    }

    /**
     * Fills projectId on records of the pool that have none. Never overwrites an existing projectId.
     *
     * @return number of records updated
     */
    public long updateProjectIdForPoolId(String poolId, String projectId) {
        Query query = Query.query(Criteria.where("poolId").is(poolId).and("projectId").is(null));
        UpdateResult result = mongoTemplate.updateMulti(query, Update.update("projectId", projectId), FeeDistribution.class);
        return result.getModifiedCount();
    }
}
