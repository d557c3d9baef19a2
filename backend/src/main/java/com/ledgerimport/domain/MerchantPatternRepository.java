package com.ledgerimport.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface MerchantPatternRepository extends MongoRepository<MerchantPattern, String> {

    Optional<MerchantPattern> findByMerchantKey(String merchantKey);
}
