package de.jwiegmann.redistribution.control.export;

import de.jwiegmann.redistribution.control.RedistributionFixture;
import de.jwiegmann.redistribution.control.port.NotificationPort;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.IntakeDraft;
import de.jwiegmann.redistribution.entity.Listing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ListingCsvExporterTest {

    private RedistributionFixture fx;
    private ListingCsvExporter exporter;

    @BeforeEach
    void setUp() {
        fx = new RedistributionFixture(mock(NotificationPort.class));
        exporter = new ListingCsvExporter(fx.registry);
    }

    @Test
    void exportsListingsOfTheYearWithCommittedClaimants() throws Exception {
        Listing listing = fx.listing("owner", "Water", 10);
        Claim a = fx.submit(listing, "alice", 6);
        Claim b = fx.submit(listing, "bob", 2);
        fx.submit(listing, "carol", 1);
        fx.engine.approve(listing.getId(), a.getSeqNo());
        fx.engine.approve(listing.getId(), b.getSeqNo());

        StringWriter out = new StringWriter();
        int rows = exporter.exportYear(LocalDate.now().getYear(), out);

        assertThat(rows).isEqualTo(1);
        String[] lines = out.toString().split("\r\n");
        assertThat(lines[0]).isEqualTo(String.join(",", ListingCsvExporter.HEADER));
        assertThat(lines[1])
                .startsWith(listing.getId() + ",Water,OPEN,owner,alice;bob,")
                .endsWith(",10,2,Ward 5,N/A");

        // claimed_at ist der Zeitpunkt der letzten Genehmigung
        String approvedAt = fx.reload(listing).findClaim(b.getSeqNo()).orElseThrow()
                .getHistory().get(1).getAt().toString();
        assertThat(lines[1].split(",")[6]).isEqualTo(approvedAt);
    }

    @Test
    void claimedAtIsEmptyWithoutCommittedClaims() throws Exception {
        Listing listing = fx.listing("owner", "Soap", 4);
        fx.submit(listing, "alice", 1);

        StringWriter out = new StringWriter();
        exporter.exportYear(LocalDate.now().getYear(), out);

        String[] fields = out.toString().split("\r\n")[1].split(",", -1);
        assertThat(fields).hasSize(ListingCsvExporter.HEADER.size());
        assertThat(fields[4]).isEmpty();
        assertThat(fields[6]).isEmpty();
    }

    @Test
    void otherYearsAreSkipped() throws Exception {
        fx.listing("owner", "Water", 10);

        StringWriter out = new StringWriter();

        assertThat(exporter.exportYear(LocalDate.now().getYear() - 1, out)).isZero();
        assertThat(out.toString().split("\r\n")).hasSize(1);
    }

    @Test
    void fieldsWithSeparatorsAreQuoted() throws Exception {
        fx.registry.create(IntakeDraft.builder()
                .userId("owner")
                .itemName("Shoes, size \"42\"")
                .totalQty(1)
                .locationLabel("Ward 5")
                .build());

        StringWriter out = new StringWriter();
        exporter.exportYear(LocalDate.now().getYear(), out);

        assertThat(out.toString()).contains(",\"Shoes, size \"\"42\"\"\",");
    }
}
