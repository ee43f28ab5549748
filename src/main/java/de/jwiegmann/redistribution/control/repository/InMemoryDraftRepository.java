package de.jwiegmann.redistribution.control.repository;

import de.jwiegmann.redistribution.entity.UserDraft;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Einfaches In-Memory Repository für Konversationsentwürfe, ein Entwurf pro Nutzer.
 * Map Struktur: Map&lt;userId, Draft&gt;.
 */
public class InMemoryDraftRepository<D extends UserDraft> implements DraftRepository<D> {

    private final Map<String, D> store = new ConcurrentHashMap<>();

    @Override
    public D save(D draft) {
        store.put(draft.getUserId(), draft);
        return draft;
    }

    @Override
    public Optional<D> find(String userId) {
        return Optional.ofNullable(store.get(userId));
    }

    @Override
    public void delete(String userId) {
        store.remove(userId);
    }

    @Override
    public List<D> findAll() {
        return new ArrayList<>(store.values());
    }
}
