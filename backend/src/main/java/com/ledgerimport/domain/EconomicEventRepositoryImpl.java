package com.ledgerimport.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class EconomicEventRepositoryImpl implements EconomicEventRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean markCorrected(String id) {
        Query query = new Query(where("_id").is(id).and("state").ne(EventState.CORRECTED));
        Update update = new Update().set("state", EventState.CORRECTED);
        return mongoTemplate.updateFirst(query, update, EconomicEvent.class).getModifiedCount() == 1;
    }
}
