package com.sharesgate.domain;

import lombok.RequiredArgsConstructor;
import org.bson.types.Decimal128;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of ShareBalanceRepositoryCustom using findAndModify with $inc on Decimal128.
 */
@Repository
@RequiredArgsConstructor
public class ShareBalanceRepositoryImpl implements ShareBalanceRepositoryCustom {

    private static final String FIELD_SHARE_AMOUNT = "shareAmount";

    private final MongoTemplate mongoTemplate;

    @Override
    public BigDecimal addShares(String trader, String subject, String chainType, BigDecimal amount) {
        Instant now = Instant.now();
        Update update = new Update()
                .inc(FIELD_SHARE_AMOUNT, new Decimal128(amount))
                .set("updatedAt", now)
                .setOnInsert("trader", trader)
                .setOnInsert("subject", subject)
                .setOnInsert("chainType", chainType)
                .setOnInsert("createdAt", now);
        ShareBalance updated = mongoTemplate.findAndModify(
                byKey(trader, subject, chainType),
                update,
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                ShareBalance.class);
        return updated.getShareAmount();
    }

    @Override
    public Optional<BigDecimal> subtractShares(String trader, String subject, String chainType, BigDecimal amount) {
        Update update = new Update()
                .inc(FIELD_SHARE_AMOUNT, new Decimal128(amount.negate()))
                .set("updatedAt", Instant.now());
        ShareBalance updated = mongoTemplate.findAndModify(
                byKey(trader, subject, chainType),
                update,
                FindAndModifyOptions.options().returnNew(true),
                ShareBalance.class);
        return Optional.ofNullable(updated).map(ShareBalance::getShareAmount);
    }

    @Override
    public void resetShares(String trader, String subject, String chainType) {
        Update update = new Update()
                .set(FIELD_SHARE_AMOUNT, new Decimal128(BigDecimal.ZERO))
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(byKey(trader, subject, chainType), update, ShareBalance.class);
    }

    private static Query byKey(String trader, String subject, String chainType) {
        return new Query(where("trader").is(trader).and("subject").is(subject).and("chainType").is(chainType));
    }
}
