package de.jwiegmann.redistribution.control.intake;

import de.jwiegmann.redistribution.boundary.dto.error.RedistributionError;
import de.jwiegmann.redistribution.control.ListingRegistry;
import de.jwiegmann.redistribution.control.NotificationService;
import de.jwiegmann.redistribution.control.RedistributionErrorFactory;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.dto.ParsedQuantity;
import de.jwiegmann.redistribution.control.repository.DraftRepository;
import de.jwiegmann.redistribution.entity.IntakeDraft;
import de.jwiegmann.redistribution.entity.IntakeStep;
import de.jwiegmann.redistribution.entity.Listing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Mehrstufiger Dialog, der aus aufeinanderfolgenden Antworten ein neues Listing erzeugt:
 * ITEM → QUANTITY → SIZE → EXPIRY → LOCATION → PHOTO → CONFIRM.
 * Eine ungültige Antwort lässt den Entwurf im aktuellen Schritt stehen.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntakeFlow {

    private static final String SKIP_PHOTO = "skip";

    private final DraftRepository<IntakeDraft> intakeDraftRepository;
    private final DraftSessionPolicy sessionPolicy;
    private final IntakeFieldParser fieldParser;
    private final ListingRegistry listingRegistry;
    private final NotificationService notificationService;

    /**
     * Startet einen neuen Entwurf. Ein bestehender Entwurf des Nutzers wird ersetzt.
     */
    public OperationResult<IntakeDraft> start(String userId, String userName) {
        if (isBlank(userId)) {
            return OperationResult.failure(missingUser());
        }

        LocalDateTime now = LocalDateTime.now();
        IntakeDraft draft = IntakeDraft.builder()
                .userId(userId)
                .userName(userName)
                .createdAt(now)
                .build();
        sessionPolicy.touch(draft, now);
        intakeDraftRepository.save(draft);

        log.debug("Intake started for user {}", userId);
        return OperationResult.success(draft);
    }

    /**
     * Beantwortet den aktuellen Schritt mit Text.
     *
     * @return der Entwurf im nächsten Schritt, oder NOT_FOUND / INVALID_STATE / INVALID_QUANTITY /
     * INVALID_DATE / VALIDATION_FAILED (Entwurf bleibt dann unverändert)
     */
    public OperationResult<IntakeDraft> answer(String userId, String text) {

        if (isBlank(userId)) {
            return OperationResult.failure(missingUser());
        }
        Optional<IntakeDraft> found = sessionPolicy.findActive(intakeDraftRepository, userId);
        if (found.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.draftNotFound(userId));
        }
        IntakeDraft draft = found.get();

        OperationResult<IntakeDraft> applied = switch (draft.getStep()) {
            case ITEM -> required(text, "item name").map(item -> {
                draft.setItemName(item);
                return draft;
            });
            case QUANTITY -> fieldParser.parseQuantity(text).map(q -> applyQuantity(draft, q));
            case SIZE -> fieldParser.normalizeSize(text).map(size -> {
                draft.setSizeLabel(size);
                return draft;
            });
            case EXPIRY -> fieldParser.parseExpiry(text).map(expiry -> {
                draft.setExpiryLabel(expiry);
                return draft;
            });
            case LOCATION -> required(text, "location").map(location -> {
                draft.setLocationLabel(location);
                return draft;
            });
            case PHOTO -> skipPhoto(draft, text);
            case CONFIRM, COMMITTED, CANCELLED ->
                    OperationResult.failure(RedistributionErrorFactory.unexpectedStep(draft.getStep().name()));
        };

        if (!applied.isSuccess()) {
            return applied;
        }
        return OperationResult.success(advance(draft));
    }

    /**
     * Hängt im Schritt PHOTO ein Foto an.
     */
    public OperationResult<IntakeDraft> attachPhoto(String userId, String photoRef) {

        if (isBlank(userId)) {
            return OperationResult.failure(missingUser());
        }
        Optional<IntakeDraft> found = sessionPolicy.findActive(intakeDraftRepository, userId);
        if (found.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.draftNotFound(userId));
        }
        IntakeDraft draft = found.get();

        if (draft.getStep() != IntakeStep.PHOTO) {
            return OperationResult.failure(RedistributionErrorFactory.unexpectedStep(draft.getStep().name()));
        }
        if (photoRef == null || photoRef.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("photo reference is blank"));
        }

        draft.setPhotoRef(photoRef);
        return OperationResult.success(advance(draft));
    }

    /**
     * Übergibt den vollständigen Entwurf an die {@link ListingRegistry}, verwirft ihn und
     * veröffentlicht den Post.
     *
     * @return das neue Listing (mit externer Referenz, sofern der Transport eine liefert)
     */
    public OperationResult<Listing> confirm(String userId) {

        if (isBlank(userId)) {
            return OperationResult.failure(missingUser());
        }
        Optional<IntakeDraft> found = sessionPolicy.findActive(intakeDraftRepository, userId);
        if (found.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.draftNotFound(userId));
        }
        IntakeDraft draft = found.get();

        if (draft.getStep() != IntakeStep.CONFIRM) {
            return OperationResult.failure(RedistributionErrorFactory.unexpectedStep(draft.getStep().name()));
        }

        OperationResult<Listing> created = listingRegistry.create(draft);
        if (!created.isSuccess()) {
            return created;
        }

        draft.setStep(IntakeStep.COMMITTED);
        intakeDraftRepository.delete(userId);

        return OperationResult.success(notificationService.publish(created.getValue()));
    }

    /**
     * Verwirft den Entwurf ohne persistente Seiteneffekte.
     */
    public OperationResult<IntakeDraft> cancel(String userId) {

        if (isBlank(userId)) {
            return OperationResult.failure(missingUser());
        }
        Optional<IntakeDraft> found = sessionPolicy.findActive(intakeDraftRepository, userId);
        if (found.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.draftNotFound(userId));
        }

        IntakeDraft draft = found.get();
        draft.setStep(IntakeStep.CANCELLED);
        intakeDraftRepository.delete(userId);

        log.debug("Intake cancelled by user {}", userId);
        return OperationResult.success(draft);
    }

    public Optional<IntakeDraft> current(String userId) {
        return sessionPolicy.findActive(intakeDraftRepository, userId);
    }

    private IntakeDraft advance(IntakeDraft draft) {
        draft.setStep(draft.getStep().next());
        sessionPolicy.touch(draft, LocalDateTime.now());
        return intakeDraftRepository.save(draft);
    }

    private static IntakeDraft applyQuantity(IntakeDraft draft, ParsedQuantity quantity) {
        draft.setTotalQty(quantity.getValue());
        draft.setQuantityLabel(quantity.getLabel());
        return draft;
    }

    private static OperationResult<IntakeDraft> skipPhoto(IntakeDraft draft, String text) {
        if (text == null || !SKIP_PHOTO.equals(text.trim().toLowerCase(Locale.ROOT))) {
            return OperationResult.failure(
                    RedistributionErrorFactory.validationFailed("send a photo or type 'skip'"));
        }
        draft.setPhotoRef(null);
        return OperationResult.success(draft);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static RedistributionError missingUser() {
        return RedistributionErrorFactory.validationFailed("user is required");
    }

    private static OperationResult<String> required(String text, String field) {
        if (text == null || text.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed(field + " is required"));
        }
        return OperationResult.success(text.trim());
    }
}
