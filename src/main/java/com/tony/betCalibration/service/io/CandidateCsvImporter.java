package com.tony.betCalibration.service.io;

import com.opencsv.CSVReaderHeaderAware;
import com.opencsv.exceptions.CsvValidationException;
import com.tony.betCalibration.model.BetCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Import des prédictions (et des résultats réels) depuis des CSV. Noms de colonnes insensibles à la casse,
 * avec alias : game_date|date, over_probability|prob_over, decimal_odds|odds...
 */
@Component
@Slf4j
public class CandidateCsvImporter {

    private static final List<String> DATE_COLUMNS = List.of("game_date", "date", "game_date_utc");
    private static final List<String> PROBABILITY_COLUMNS = List.of("over_probability", "prob_over", "probability");
    private static final List<String> ODDS_COLUMNS = List.of("decimal_odds", "odds");
    private static final List<String> ACTUAL_COLUMNS = List.of("actual_value", "value");

    private static final double DEFAULT_PROBABILITY = 0.5;
    private static final double DEFAULT_ODDS = 2.0;

    /**
     * Prédictions seules : la colonne actual_value, si présente, porte déjà le résultat.
     */
    public List<BetCandidate> read(Reader predictions) {
        return read(predictions, null);
    }

    /**
     * Prédictions + résultats réels joints sur (joueur, date). Sans résultat, le candidat reste "en attente".
     */
    public List<BetCandidate> read(Reader predictions, Reader actuals) {
        Map<String, Double> actualByKey = actuals != null ? readActuals(actuals) : Map.of();

        List<Map<String, String>> rows = readRows(predictions);
        List<BetCandidate> candidates = new ArrayList<>(rows.size());
        int rejected = 0;

        for (Map<String, String> row : rows) {
            String dateColumn = firstPresent(row, DATE_COLUMNS)
                    .orElseThrow(() -> new IllegalArgumentException("Le CSV de prédictions doit contenir une colonne date/game_date"));
            if (!row.containsKey("player")) {
                throw new IllegalArgumentException("Le CSV de prédictions doit contenir une colonne 'player'");
            }

            CoercionResult<LocalDateTime> date = ValueCoercer.toDateTime(row.get(dateColumn));
            if (!date.isSuccess()) {
                rejected++;
                log.warn("Ligne ignorée ({}) : date illisible '{}' ({})", row.get("player"), row.get(dateColumn), date.describeFailure());
                continue;
            }

            String player = row.get("player");
            Double actual = optionalNumber(row, ACTUAL_COLUMNS)
                    .orElse(actualByKey.get(key(player, date.value().toLocalDate())));

            candidates.add(BetCandidate.builder()
                    .eventDate(date.value())
                    .selection(player)
                    .probability(optionalNumber(row, PROBABILITY_COLUMNS).orElse(DEFAULT_PROBABILITY))
                    .odds(optionalNumber(row, ODDS_COLUMNS).orElse(DEFAULT_ODDS))
                    .oddsOpposite(optionalNumber(row, List.of("decimal_odds_under")).orElse(null))
                    .confidence(optionalNumber(row, List.of("confidence")).orElse(null))
                    .line(optionalNumber(row, List.of("line")).orElse(null))
                    .predictedValue(optionalNumber(row, List.of("predicted_value")).orElse(null))
                    .actualValue(actual)
                    .build());
        }

        log.info("📥 {} candidats importés ({} lignes rejetées)", candidates.size(), rejected);
        return candidates;
    }

    private Map<String, Double> readActuals(Reader actuals) {
        Map<String, Double> byKey = new HashMap<>();
        for (Map<String, String> row : readRows(actuals)) {
            String dateColumn = firstPresent(row, List.of("game_date", "date"))
                    .orElseThrow(() -> new IllegalArgumentException("Le CSV de résultats doit contenir une colonne date/game_date"));
            Optional<LocalDateTime> date = ValueCoercer.toDateTime(row.get(dateColumn)).toOptional();
            Optional<Double> value = optionalNumber(row, ACTUAL_COLUMNS);
            if (firstPresent(row, ACTUAL_COLUMNS).isEmpty()) {
                throw new IllegalArgumentException("Le CSV de résultats doit contenir 'actual_value' ou 'value'");
            }
            if (date.isPresent() && value.isPresent()) {
                byKey.put(key(row.get("player"), date.get().toLocalDate()), value.get());
            }
        }
        return byKey;
    }

    private List<Map<String, String>> readRows(Reader reader) {
        List<Map<String, String>> rows = new ArrayList<>();
        try (CSVReaderHeaderAware csv = new CSVReaderHeaderAware(reader)) {
            Map<String, String> raw;
            while ((raw = csv.readMap()) != null) {
                Map<String, String> row = new HashMap<>();
                raw.forEach((k, v) -> row.put(k.trim().toLowerCase(Locale.ROOT), v));
                rows.add(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Lecture CSV impossible", e);
        } catch (CsvValidationException e) {
            throw new IllegalArgumentException("CSV invalide ligne " + e.getLineNumber() + " : " + e.getMessage(), e);
        }
        return rows;
    }

    private static Optional<String> firstPresent(Map<String, String> row, List<String> columns) {
        return columns.stream().filter(row::containsKey).findFirst();
    }

    private static Optional<Double> optionalNumber(Map<String, String> row, List<String> columns) {
        return firstPresent(row, columns)
                .map(row::get)
                .flatMap(v -> ValueCoercer.toDouble(v).toOptional());
    }

    private static String key(String player, LocalDate date) {
        return player + "|" + date;
    }
}
