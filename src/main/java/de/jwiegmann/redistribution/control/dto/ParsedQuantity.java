package de.jwiegmann.redistribution.control.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Geparste Mengenangabe: numerischer Wert für die Bestandsführung plus Originaltext zur Anzeige.
 */
@Data
@AllArgsConstructor
public class ParsedQuantity {
    private int value;
    private String label;
}
