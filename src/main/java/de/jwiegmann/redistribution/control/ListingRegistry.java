package de.jwiegmann.redistribution.control;

import de.jwiegmann.redistribution.control.dto.MutationResult;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.repository.AtomicStore;
import de.jwiegmann.redistribution.control.repository.ListingTransactor;
import de.jwiegmann.redistribution.entity.IntakeDraft;
import de.jwiegmann.redistribution.entity.Listing;
import de.jwiegmann.redistribution.entity.ListingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD über Listings. Vergibt IDs; der Status wird ausschließlich abgeleitet.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ListingRegistry {

    private final AtomicStore<Listing> listingStore;
    private final ListingTransactor transactor;

    /**
     * Legt aus einem bestätigten Intake-Entwurf ein neues Listing an.
     * Vor dem ersten Claim ist keine Konkurrenz möglich, daher einfacher put.
     *
     * @param draft vollständiger Entwurf
     * @return das angelegte Listing im Status OPEN, oder VALIDATION_FAILED
     */
    public OperationResult<Listing> create(final IntakeDraft draft) {

        // 1. Pflichtfelder prüfen
        if (draft == null) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("draft missing"));
        }
        if (draft.getTotalQty() == null || draft.getTotalQty() <= 0) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("total quantity must be positive"));
        }
        if (isBlank(draft.getUserId()) || isBlank(draft.getItemName()) || isBlank(draft.getLocationLabel())) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("owner, item and location are required"));
        }

        // 2. ID vergeben und Listing erzeugen
        String id = UUID.randomUUID().toString();
        LocalDateTime now = LocalDateTime.now();

        Listing listing = Listing.builder()
                .id(id)
                .ownerId(draft.getUserId())
                .ownerName(draft.getUserName())
                .itemName(draft.getItemName())
                .quantityLabel(draft.getQuantityLabel() != null ? draft.getQuantityLabel() : String.valueOf(draft.getTotalQty()))
                .sizeLabel(draft.getSizeLabel())
                .expiryLabel(draft.getExpiryLabel())
                .locationLabel(draft.getLocationLabel())
                .photoRef(draft.getPhotoRef())
                .totalQty(draft.getTotalQty())
                .claims(new ArrayList<>())
                .createdAt(now)
                .updatedAt(now)
                .build();

        // 3. Persistieren
        listingStore.put(id, listing);
        log.info("Listing created: id={}, item='{}', totalQty={}, owner={}",
                id, listing.getItemName(), listing.getTotalQty(), listing.getOwnerId());
        return OperationResult.success(listing);
    }

    public Optional<Listing> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return listingStore.get(id);
    }

    /**
     * @return alle Listings, älteste zuerst
     */
    public List<Listing> findAll() {
        return listingStore.findAll().stream()
                .sorted(Comparator.comparing(Listing::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    public List<Listing> findOpen() {
        return findAll().stream()
                .filter(l -> l.getStatus() == ListingStatus.OPEN)
                .toList();
    }

    /**
     * Setzt die externe Referenz nur, wenn noch keine gesetzt ist. Wiederholungen sind idempotent.
     *
     * @return das Listing nach der Operation
     */
    public OperationResult<Listing> attachExternalRef(String id, String externalRef) {
        if (isBlank(externalRef)) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("external reference is blank"));
        }

        return transactor.execute(id, listing -> {
            if (listing.getExternalRef() != null) {
                return MutationResult.skip();
            }
            listing.setExternalRef(externalRef);
            return MutationResult.commit();
        });
    }

    /**
     * Markiert ein offenes Listing als abgelaufen. Kein Effekt, wenn es bereits vollständig
     * vergeben oder schon abgelaufen ist.
     *
     * @return das Listing nach der Operation
     */
    public OperationResult<Listing> markExpired(String id) {
        OperationResult<Listing> result = transactor.execute(id, listing -> {
            if (listing.getStatus() != ListingStatus.OPEN) {
                return MutationResult.skip();
            }
            listing.setExpiredAt(LocalDateTime.now());
            return MutationResult.commit();
        });

        if (result.isSuccess() && result.getValue().getStatus() == ListingStatus.EXPIRED) {
            log.info("Listing expired: id={}, remaining={}", id, result.getValue().getRemainingQty());
        }
        return result;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
