package com.blueprint.core.persistence;

import com.blueprint.core.model.BreakdownSession;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryBreakdownSessionRepository extends InMemorySessionRepository<BreakdownSession>
        implements BreakdownSessionRepository {

    public InMemoryBreakdownSessionRepository() {
        super(BreakdownSession::ideaId);
    }
}
