package com.feetrail.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Read access to fee_distributions. Writes go through FeeDistributionStore.
 */
public interface FeeDistributionRepository extends MongoRepository<FeeDistribution, String> {

    List<FeeDistribution> findByTxHashOrderByLogIndexAsc(String txHash);
}
