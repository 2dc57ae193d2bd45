package com.feetrail.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ProjectRepository extends MongoRepository<Project, String> {

    /** Projects with a launched pool (pool to project mapping). */
    List<Project> findByPoolIdIsNotNull();

    /** Projects with a pool and a verified owner (startup routing sweep). */
    List<Project> findByPoolIdIsNotNullAndOwnerWalletIsNotNull();
}
