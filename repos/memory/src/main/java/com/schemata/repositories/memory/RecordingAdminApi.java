package com.schemata.repositories.memory;

import com.schemata.core.AdminApi;
import com.schemata.core.SchemaSubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Admin API that records submissions instead of executing them. Used for dry runs.
 */
public class RecordingAdminApi implements AdminApi {
    private static final Logger logger = LoggerFactory.getLogger(RecordingAdminApi.class);

    public record Submission(String operationId, List<String> ddl) {
        public Submission {
            ddl = List.copyOf(ddl);
        }
    }

    private final List<Submission> submissions = new ArrayList<>();
    private String failure;

    @Override
    public synchronized void updateSchema(List<String> ddl, String operationId) {
        if (failure != null) {
            throw new SchemaSubmissionException(failure);
        }
        logger.debug("Recorded schema update {}: {}", operationId, ddl);
        submissions.add(new Submission(operationId, ddl));
    }

    /**
     * Makes every following submission fail with {@code message}; {@code null} restores normal recording.
     */
    public synchronized RecordingAdminApi failWith(String message) {
        this.failure = message;
        return this;
    }

    public synchronized List<Submission> submissions() {
        return List.copyOf(submissions);
    }

    public synchronized List<String> statements() {
        List<String> statements = new ArrayList<>();
        for (Submission submission : submissions) {
            statements.addAll(submission.ddl());
        }
        return statements;
    }
}
