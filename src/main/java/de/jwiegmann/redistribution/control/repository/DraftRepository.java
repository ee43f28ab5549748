package de.jwiegmann.redistribution.control.repository;

import de.jwiegmann.redistribution.entity.UserDraft;

import java.util.List;
import java.util.Optional;

public interface DraftRepository<D extends UserDraft> {

    D save(D draft);
    Optional<D> find(String userId);
    void delete(String userId);
    List<D> findAll();
}
