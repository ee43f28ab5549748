package de.jwiegmann.redistribution.control.intake;

import de.jwiegmann.redistribution.control.repository.DraftRepository;
import de.jwiegmann.redistribution.entity.UserDraft;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Lifecycle der Konversationsentwürfe: Idle-Timeout verlängern, abgelaufene Entwürfe verwerfen.
 */
@Slf4j
@Component
public class DraftSessionPolicy {

    private final Duration idleTimeout;

    public DraftSessionPolicy(@Value("${redistribution.session.idle-timeout:PT30M}") Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    /**
     * Erneuert die Expiry-Zeit nach jeder Interaktion.
     */
    public void touch(UserDraft draft, LocalDateTime now) {
        draft.setExpiresAt(now.plus(idleTimeout));
    }

    public boolean isExpired(UserDraft draft, LocalDateTime now) {
        return draft.getExpiresAt() != null && now.isAfter(draft.getExpiresAt());
    }

    /**
     * Liefert den Entwurf des Nutzers, sofern er nicht abgelaufen ist.
     * Ein abgelaufener Entwurf wird dabei gelöscht.
     */
    public <D extends UserDraft> Optional<D> findActive(DraftRepository<D> repository, String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        Optional<D> draft = repository.find(userId);
        if (draft.isPresent() && isExpired(draft.get(), LocalDateTime.now())) {
            repository.delete(userId);
            log.debug("Discarded idle draft of user {}", userId);
            return Optional.empty();
        }
        return draft;
    }

    /**
     * Entfernt alle abgelaufenen Entwürfe.
     *
     * @return Anzahl entfernter Entwürfe
     */
    public <D extends UserDraft> int purgeExpired(DraftRepository<D> repository, LocalDateTime now) {
        int purged = 0;
        for (D draft : repository.findAll()) {
            if (isExpired(draft, now)) {
                repository.delete(draft.getUserId());
                purged++;
            }
        }
        return purged;
    }
}
