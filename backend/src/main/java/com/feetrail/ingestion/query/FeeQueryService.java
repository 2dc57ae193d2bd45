package com.feetrail.ingestion.query;

import com.feetrail.config.CaffeineConfig;
import com.feetrail.domain.FeeDistribution;
import com.feetrail.domain.FeeDistributionRepository;
import com.feetrail.domain.FeeEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Read-only queries over fee_distributions.
 */
@Service
@RequiredArgsConstructor
public class FeeQueryService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final MongoTemplate mongoTemplate;
    private final FeeDistributionRepository distributionRepository;

    public DistributionPage find(DistributionFilter filter, Integer limit, Integer offset) {
        int pageSize = clampLimit(limit);
        int skip = offset == null ? 0 : Math.max(0, offset);
        Query query = new Query();
        for (Criteria criteria : criteria(filter)) {
            query.addCriteria(criteria);
        }
        query.with(Sort.by(Sort.Order.desc("blockNumber"), Sort.Order.desc("logIndex")))
                .skip(skip)
                .limit(pageSize + 1);
        List<FeeDistribution> found = mongoTemplate.find(query, FeeDistribution.class);
        boolean hasMore = found.size() > pageSize;
        List<FeeDistribution> items = hasMore ? found.subList(0, pageSize) : found;
        return new DistributionPage(List.copyOf(items), pageSize, skip, hasMore);
    }

    public List<FeeDistribution> findByTxHash(String txHash) {
        return distributionRepository.findByTxHashOrderByLogIndexAsc(txHash.toLowerCase(Locale.ROOT));
    }

    @Cacheable(cacheNames = CaffeineConfig.FEE_TOTALS_CACHE, key = "'all'")
    public FeeTotals totals() {
        BigInteger distributed = BigInteger.ZERO;
        BigInteger devClaimed = BigInteger.ZERO;
        BigInteger protocolClaimed = BigInteger.ZERO;
        BigInteger escrowed = BigInteger.ZERO;
        long depositCount = 0;
        Set<String> devs = new HashSet<>();
        Set<String> pools = new HashSet<>();
        Long lastBlock = null;
        Instant lastIndexedAt = null;

        try (Stream<FeeDistribution> all = mongoTemplate.stream(new Query(), FeeDistribution.class)) {
            for (FeeDistribution d : (Iterable<FeeDistribution>) all::iterator) {
                if (d.getEventType() == FeeEventType.DEPOSIT) {
                    distributed = distributed.add(amount(d.getDevAmount())).add(amount(d.getProtocolAmount()));
                    depositCount++;
                    if (d.getDevAddress() != null) devs.add(d.getDevAddress());
                    if (d.getPoolId() != null) pools.add(d.getPoolId());
                } else if (d.getEventType() == FeeEventType.DEV_CLAIMED) {
                    devClaimed = devClaimed.add(amount(d.getAmount()));
                } else if (d.getEventType() == FeeEventType.PROTOCOL_CLAIMED) {
                    protocolClaimed = protocolClaimed.add(amount(d.getAmount()));
                } else if (d.getEventType() == FeeEventType.ESCROW) {
                    escrowed = escrowed.add(amount(d.getAmount()));
                    if (d.getPoolId() != null) pools.add(d.getPoolId());
                }
                if (lastBlock == null || d.getBlockNumber() > lastBlock) {
                    lastBlock = d.getBlockNumber();
                }
                if (d.getIndexedAt() != null && (lastIndexedAt == null || d.getIndexedAt().isAfter(lastIndexedAt))) {
                    lastIndexedAt = d.getIndexedAt();
                }
            }
        }
        return new FeeTotals(distributed.toString(), devClaimed.toString(), protocolClaimed.toString(),
                escrowed.toString(), depositCount, devs.size(), pools.size(), lastBlock, lastIndexedAt);
    }

    static int clampLimit(Integer limit) {
        if (limit == null) return DEFAULT_LIMIT;
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }

    private static List<Criteria> criteria(DistributionFilter filter) {
        List<Criteria> criteria = new ArrayList<>();
        if (filter == null) return criteria;
        if (filter.eventType() != null) criteria.add(Criteria.where("eventType").is(filter.eventType()));
        if (filter.poolId() != null) criteria.add(Criteria.where("poolId").is(lower(filter.poolId())));
        if (filter.devAddress() != null) criteria.add(Criteria.where("devAddress").is(lower(filter.devAddress())));
        if (filter.tokenAddress() != null) criteria.add(Criteria.where("tokenAddress").is(lower(filter.tokenAddress())));
        if (filter.projectId() != null) criteria.add(Criteria.where("projectId").is(filter.projectId()));
        return criteria;
    }

    private static BigInteger amount(String value) {
        if (value == null || value.isBlank()) return BigInteger.ZERO;
        return new BigInteger(value);
    }

    private static String lower(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
