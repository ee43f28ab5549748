package de.jwiegmann.redistribution.control.export;

import de.jwiegmann.redistribution.control.ListingRegistry;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.ClaimHistoryEntry;
import de.jwiegmann.redistribution.entity.Listing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Jahresexport aller Listings als CSV (RFC 4180 Quoting).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ListingCsvExporter {

    static final List<String> HEADER = List.of(
            "listing_id", "item_name", "status", "owner_id", "claimed_by",
            "created_at", "claimed_at", "quantity", "remaining", "location", "expiry");

    private final ListingRegistry listingRegistry;

    /**
     * Schreibt eine Zeile pro Listing, das im angegebenen Jahr angelegt wurde.
     *
     * @return Anzahl geschriebener Datenzeilen
     */
    public int exportYear(int year, Writer writer) throws IOException {

        writeRow(writer, HEADER);

        int rows = 0;
        for (Listing listing : listingRegistry.findAll()) {
            if (listing.getCreatedAt() == null || listing.getCreatedAt().getYear() != year) {
                continue;
            }
            writeRow(writer, List.of(
                    listing.getId(),
                    nullToEmpty(listing.getItemName()),
                    listing.getStatus().name(),
                    nullToEmpty(listing.getOwnerId()),
                    claimedBy(listing),
                    listing.getCreatedAt().toString(),
                    claimedAt(listing),
                    String.valueOf(listing.getTotalQty()),
                    String.valueOf(listing.getRemainingQty()),
                    nullToEmpty(listing.getLocationLabel()),
                    nullToEmpty(listing.getExpiryLabel())));
            rows++;
        }
        writer.flush();

        log.info("Exported {} listings for year {}", rows, year);
        return rows;
    }

    // Claimants aller committeten Claims, in Ankunftsreihenfolge
    private static String claimedBy(Listing listing) {
        return listing.getClaims().stream()
                .filter(Claim::isCommitted)
                .map(Claim::getClaimantId)
                .collect(Collectors.joining(";"));
    }

    // Zeitpunkt der letzten Commit-Entscheidung, leer solange nichts vergeben ist
    private static String claimedAt(Listing listing) {
        return listing.getClaims().stream()
                .filter(Claim::isCommitted)
                .flatMap(claim -> claim.getHistory().stream())
                .filter(entry -> entry.getStatus().isCommitted())
                .map(ClaimHistoryEntry::getAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .map(LocalDateTime::toString)
                .orElse("");
    }

    private static void writeRow(Writer writer, List<String> fields) throws IOException {
        writer.write(fields.stream().map(ListingCsvExporter::escape).collect(Collectors.joining(",")));
        writer.write("\r\n");
    }

    static String escape(String field) {
        if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
