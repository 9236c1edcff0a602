package dev.marketbloom.repository;

import dev.marketbloom.entity.Submission;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import reactor.core.publisher.Mono;

@RequiredArgsConstructor
public class SubmissionInsertOperationsImpl implements SubmissionInsertOperations {

    private static final String INSERT_SUBMISSION_SQL = """
            INSERT INTO submissions (name, business, service, phone, message)
            VALUES (:name, :business, :service, :phone, :message)
            """;

    private final R2dbcEntityTemplate template;

    @Override
    public Mono<Long> insertSubmission(Submission submission) {
        return template.getDatabaseClient().sql(INSERT_SUBMISSION_SQL)
                .filter(statement -> statement.returnGeneratedValues("id"))
                .bind("name", submission.getName())
                .bind("business", submission.getBusiness())
                .bind("service", submission.getService())
                .bind("phone", submission.getPhone())
                .bind("message", submission.getMessage() != null ? submission.getMessage() : "")
                .map((row, metadata) -> row.get(0, Long.class))
                .one();
    }
}
