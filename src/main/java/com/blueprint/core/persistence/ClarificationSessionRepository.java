package com.blueprint.core.persistence;

import com.blueprint.core.model.ClarificationSession;

public interface ClarificationSessionRepository extends SessionRepository<ClarificationSession> {
}
