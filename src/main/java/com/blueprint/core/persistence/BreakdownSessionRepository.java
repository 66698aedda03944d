package com.blueprint.core.persistence;

import com.blueprint.core.model.BreakdownSession;

public interface BreakdownSessionRepository extends SessionRepository<BreakdownSession> {
}
