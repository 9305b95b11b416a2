package com.mempooltracker.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.mempooltracker.entities.database.ReplacementEvent;

public interface ReplacementEventRepository extends MongoRepository<ReplacementEvent, String> {

	List<ReplacementEvent> findByInputsHashOrderByCreatedAtAsc(String inputsHash);

}
