package com.tony.betCalibration.service.io;

import java.util.List;
import java.util.Optional;

/**
 * Résultat d'une conversion de valeur brute : la valeur, ou la liste des raisons pour lesquelles
 * aucune stratégie ne s'est appliquée.
 */
public record CoercionResult<T>(T value, String strategy, List<String> rejections) {

    public static <T> CoercionResult<T> success(T value, String strategy, List<String> rejections) {
        return new CoercionResult<>(value, strategy, List.copyOf(rejections));
    }

    public static <T> CoercionResult<T> failure(List<String> rejections) {
        return new CoercionResult<>(null, null, List.copyOf(rejections));
    }

    public boolean isSuccess() {
        return value != null;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public String describeFailure() {
        return String.join("; ", rejections);
    }
}
