package de.jwiegmann.redistribution.control.intake;

import de.jwiegmann.redistribution.control.RedistributionErrorFactory;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.dto.ParsedQuantity;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parst die Freitext-Antworten des Intake-Flows.
 */
@Component
public class IntakeFieldParser {

    public static final String NO_EXPIRY = "N/A";
    public static final String SIZE_NOT_APPLICABLE = "Not applicable";

    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+");

    private static final Set<String> EXPIRY_SENTINELS = Set.of("na", "n/a", "none");
    private static final Set<String> SIZE_SENTINELS = Set.of("na", "n/a");

    // Reihenfolge relevant: vierstellige Jahre zuerst
    private static final List<DateTimeFormatter> EXPIRY_FORMATS = List.of(
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d/M/uu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT));

    private static final DateTimeFormatter EXPIRY_OUTPUT = DateTimeFormatter.ofPattern("dd/MM/yy");

    /**
     * Erste Ganzzahl im Text wird zur Menge, der gesamte Text bleibt als Label erhalten.
     * "3 big boxes" ergibt (3, "3 big boxes").
     *
     * @return die Menge, oder INVALID_QUANTITY wenn keine positive Zahl enthalten ist
     */
    public OperationResult<ParsedQuantity> parseQuantity(String text) {
        if (text == null || text.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.invalidQuantity(text));
        }

        String label = text.trim();
        Matcher m = FIRST_NUMBER.matcher(label);
        if (!m.find()) {
            return OperationResult.failure(RedistributionErrorFactory.invalidQuantity(text));
        }

        int value;
        try {
            value = Integer.parseInt(m.group());
        } catch (NumberFormatException e) {
            return OperationResult.failure(RedistributionErrorFactory.invalidQuantity(text));
        }

        if (value <= 0) {
            return OperationResult.failure(RedistributionErrorFactory.invalidQuantity(text));
        }
        return OperationResult.success(new ParsedQuantity(value, label));
    }

    /**
     * Akzeptiert "na", "n/a" oder "none" (Groß-/Kleinschreibung egal) sowie
     * DD/MM/YYYY, DD/MM/YY und YYYY-MM-DD.
     *
     * @return {@link #NO_EXPIRY} oder das Datum als dd/MM/yy, sonst INVALID_DATE
     */
    public OperationResult<String> parseExpiry(String text) {
        if (text == null || text.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.invalidDate(text));
        }

        String trimmed = text.trim();
        if (EXPIRY_SENTINELS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return OperationResult.success(NO_EXPIRY);
        }

        return EXPIRY_FORMATS.stream()
                .map(format -> tryParse(trimmed, format))
                .flatMap(Optional::stream)
                .findFirst()
                .map(date -> OperationResult.success(date.format(EXPIRY_OUTPUT)))
                .orElseGet(() -> OperationResult.failure(RedistributionErrorFactory.invalidDate(text)));
    }

    public OperationResult<String> normalizeSize(String text) {
        if (text == null || text.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("size is required"));
        }

        String trimmed = text.trim();
        if (SIZE_SENTINELS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return OperationResult.success(SIZE_NOT_APPLICABLE);
        }
        return OperationResult.success(trimmed);
    }

    private static Optional<LocalDate> tryParse(String text, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(text, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
