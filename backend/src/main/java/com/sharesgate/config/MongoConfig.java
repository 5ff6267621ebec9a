package com.sharesgate.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Arrays;

/**
 * MongoDB configuration: Decimal128 codec for share amounts and the transaction boundary used by the ledger.
 * Indexes are created from @CompoundIndex / @Indexed on domain documents at startup.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(Arrays.asList(
                new BigDecimalToDecimal128Converter(),
                new Decimal128ToBigDecimalConverter()
        ));
    }

    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    /**
     * Ledger unit of work. Multi-document transactions need a replica set; standalone development
     * servers can run with {@code sharesgate.ledger.transactional=false}.
     */
    @Bean
    public TransactionOperations ledgerTransactionOperations(
            MongoTransactionManager transactionManager,
            @Value("${sharesgate.ledger.transactional:true}") boolean transactional) {
        if (!transactional) {
            return TransactionOperations.withoutTransaction();
        }
        return new TransactionTemplate(transactionManager);
    }
}
