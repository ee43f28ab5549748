package de.jwiegmann.redistribution.entity;

import java.time.LocalDateTime;

/**
 * Gemeinsame Sicht auf transiente, pro Nutzer gehaltene Konversationsentwürfe.
 */
public interface UserDraft {

    String getUserId();

    LocalDateTime getExpiresAt();

    void setExpiresAt(LocalDateTime expiresAt);
}
