package de.jwiegmann.redistribution.control.repository;

import de.jwiegmann.redistribution.entity.IntakeDraft;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryIntakeDraftRepository extends InMemoryDraftRepository<IntakeDraft> {
}
