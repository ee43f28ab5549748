package de.jwiegmann.redistribution.entity;

/**
 * Abgeleiteter Status eines Listings. Wird nie direkt gesetzt, sondern aus den Claims berechnet.
 */
public enum ListingStatus {
    OPEN,             // committedQty < totalQty
    FULLY_COMMITTED,  // committedQty == totalQty
    EXPIRED           // extern als veraltet markiert
}
