package com.mempooltracker.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.mempooltracker.entities.database.MempoolSnapshot;

public interface MempoolSnapshotRepository extends MongoRepository<MempoolSnapshot, String> {

}
