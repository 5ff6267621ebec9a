package com.sharesgate.domain;

import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of UserMappingRepositoryCustom using MongoTemplate upserts.
 */
@Repository
@RequiredArgsConstructor
public class UserMappingRepositoryImpl implements UserMappingRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public UserMapping upsertIdentity(String address, String chainType, String externalIdentity) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("externalIdentity", externalIdentity)
                .set("updatedAt", now)
                .setOnInsert("address", address)
                .setOnInsert("chainType", chainType)
                .setOnInsert("gated", false)
                .setOnInsert("createdAt", now);
        return mongoTemplate.findAndModify(
                byKey(address, chainType),
                update,
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                UserMapping.class);
    }

    @Override
    public boolean markGated(String address, String chainType) {
        Update update = new Update().set("gated", true).set("updatedAt", Instant.now());
        UpdateResult result = mongoTemplate.updateFirst(byKey(address, chainType), update, UserMapping.class);
        return result.getMatchedCount() > 0;
    }

    private static Query byKey(String address, String chainType) {
        return new Query(where("address").is(address).and("chainType").is(chainType));
    }
}
