package com.regatta.web;

import com.regatta.model.RacePhase;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Binds phase path segments. Accepts the enum name in any case
 * ({@code semifinal}) or the race-code prefix ({@code SF}).
 */
@Component
public class RacePhaseConverter implements Converter<String, RacePhase> {

    @Override
    public RacePhase convert(String source) {
        String value = source.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (RacePhase phase : RacePhase.values()) {
            if (phase.name().equals(value) || phase.getCodePrefix().equals(value)) {
                return phase;
            }
        }
        throw new RegattaValidationException("Unknown race phase: " + source);
    }
}
