package com.ledgerimport.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AggregatorConnectionRepository extends MongoRepository<AggregatorConnection, String> {

    List<AggregatorConnection> findByOwnerId(String ownerId);
}
