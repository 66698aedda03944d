package com.blueprint.core.persistence;

import com.blueprint.core.model.ClarificationSession;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryClarificationSessionRepository extends InMemorySessionRepository<ClarificationSession>
        implements ClarificationSessionRepository {

    public InMemoryClarificationSessionRepository() {
        super(ClarificationSession::ideaId);
    }
}
