package de.jwiegmann.redistribution.control.repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Key-Value-Store mit Compare-and-Set-Transaktion pro Key.
 * Einziger Weg, einen bestehenden Record zu verändern.
 */
public interface AtomicStore<V> {

    Optional<V> get(String key);

    /**
     * Schreibt ohne Konfliktprüfung. Nur für Records ohne mögliche Konkurrenz (Neuanlage).
     */
    void put(String key, V value);

    /**
     * Wendet {@code mutation} auf den aktuellen Wert an und committet nur, wenn seit dem Lesen
     * kein anderer Schreiber den Key verändert hat. Liefert die Mutation {@link Optional#empty()},
     * wird ohne Schreibvorgang abgebrochen.
     *
     * @return COMMITTED mit dem geschriebenen Wert, CONFLICT oder ABORTED
     */
    StoreResult<V> transact(String key, Function<Optional<V>, Optional<V>> mutation);

    List<V> findAll();
}
