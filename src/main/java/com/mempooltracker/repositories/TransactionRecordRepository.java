package com.mempooltracker.repositories;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.mempooltracker.entities.database.TransactionRecord;

public interface TransactionRecordRepository extends MongoRepository<TransactionRecord, String> {

	Optional<TransactionRecord> findFirstByTxid(String txid);

}
