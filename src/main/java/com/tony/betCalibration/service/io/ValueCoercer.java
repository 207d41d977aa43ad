package com.tony.betCalibration.service.io;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Conversion des cellules CSV par une liste ordonnée de stratégies.
 * Chaque stratégie déclare quand elle s'applique ; la première qui convertit gagne, les autres expliquent leur refus.
 */
public final class ValueCoercer {

    private static final Pattern PLAIN_NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern COMMA_DECIMAL = Pattern.compile("[-+]?\\d+,\\d+");
    private static final Pattern PERCENT = Pattern.compile("[-+]?\\d+(\\.\\d+)?\\s*%");

    private static final Pattern ISO_DATE_TIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern SLASH_DATE = Pattern.compile("\\d{2}/\\d{2}/\\d{4}");
    private static final DateTimeFormatter SLASH_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private static final List<Strategy<Double>> NUMBER_STRATEGIES = List.of(
            new Strategy<>("décimal", PLAIN_NUMBER, Double::parseDouble),
            new Strategy<>("virgule décimale", COMMA_DECIMAL, s -> Double.parseDouble(s.replace(',', '.'))),
            new Strategy<>("pourcentage", PERCENT, s -> Double.parseDouble(s.replace("%", "").trim()) / 100.0)
    );

    private static final List<Strategy<LocalDateTime>> DATE_STRATEGIES = List.of(
            new Strategy<>("ISO date-heure", ISO_DATE_TIME, s -> LocalDateTime.parse(s.replace(' ', 'T'))),
            new Strategy<>("ISO date", ISO_DATE, s -> LocalDate.parse(s).atStartOfDay()),
            new Strategy<>("jj/mm/aaaa", SLASH_DATE, s -> LocalDate.parse(s, SLASH_FORMAT).atTime(LocalTime.MIDNIGHT))
    );

    private ValueCoercer() {
    }

    public static CoercionResult<Double> toDouble(String raw) {
        return coerce(raw, NUMBER_STRATEGIES);
    }

    public static CoercionResult<LocalDateTime> toDateTime(String raw) {
        return coerce(raw, DATE_STRATEGIES);
    }

    private static <T> CoercionResult<T> coerce(String raw, List<Strategy<T>> strategies) {
        List<String> rejections = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            rejections.add("valeur vide");
            return CoercionResult.failure(rejections);
        }
        String text = raw.trim();
        for (Strategy<T> strategy : strategies) {
            if (!strategy.pattern().matcher(text).matches()) {
                rejections.add(strategy.name() + " : format différent");
                continue;
            }
            try {
                return CoercionResult.success(strategy.converter().apply(text), strategy.name(), rejections);
            } catch (DateTimeParseException | NumberFormatException e) {
                // Format reconnu mais valeur impossible (ex : 2024-13-45)
                rejections.add(strategy.name() + " : " + e.getMessage());
            }
        }
        return CoercionResult.failure(rejections);
    }

    private record Strategy<T>(String name, Pattern pattern, Function<String, T> converter) {
    }
}
