package com.eyelevel.flambientprocessor.dto.imagen;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Photography genre hint sent with an edit request.
 */
@Getter
@RequiredArgsConstructor
public enum PhotographyType {
    REAL_ESTATE("Real Estate"),
    WEDDING("Wedding"),
    PORTRAIT("Portrait"),
    PRODUCT("Product"),
    LANDSCAPE("Landscape"),
    EVENT("Event");

    private final String label;

    /**
     * Case-insensitive lookup accepting either the constant name or a dashed form ({@code real-estate}).
     */
    public static Optional<PhotographyType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase();
        return Arrays.stream(values()).filter(type -> type.name().equals(normalized)).findFirst();
    }
}
