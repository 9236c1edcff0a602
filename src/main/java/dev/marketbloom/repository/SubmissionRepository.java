package dev.marketbloom.repository;

import dev.marketbloom.entity.Submission;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface SubmissionRepository extends ReactiveCrudRepository<Submission, Long>, SubmissionInsertOperations {

    Flux<Submission> findAllByOrderByTimestampDescIdDesc();

    @Modifying
    @Query("DELETE FROM submissions WHERE id = :id")
    Mono<Long> deleteSubmissionById(Long id);
}
