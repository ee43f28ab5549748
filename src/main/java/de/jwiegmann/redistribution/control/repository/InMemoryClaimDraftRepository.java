package de.jwiegmann.redistribution.control.repository;

import de.jwiegmann.redistribution.entity.ClaimDraft;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryClaimDraftRepository extends InMemoryDraftRepository<ClaimDraft> {
}
