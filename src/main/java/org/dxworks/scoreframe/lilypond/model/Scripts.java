package org.dxworks.scoreframe.lilypond.model;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Vocabulary of post-event commands: named scripts, their one-character abbreviations and dynamics.
 */
public final class Scripts {

    public static final Set<String> NAMED = Set.of(
            "accent", "espressivo", "marcato", "portato", "staccatissimo", "staccato", "tenuto",
            "prall", "prallup", "pralldown", "upprall", "downprall", "prallprall", "lineprall",
            "prallmordent", "mordent", "upmordent", "downmordent", "trill", "turn", "reverseturn",
            "shortfermata", "fermata", "longfermata", "verylongfermata",
            "upbow", "downbow", "flageolet", "open", "halfopen", "stopped", "snappizzicato", "thumb",
            "lheel", "rheel", "ltoe", "rtoe", "segno", "coda", "varcoda", "signumcongruentiae");

    public static final Set<String> DYNAMICS = Set.of(
            "ppppp", "pppp", "ppp", "pp", "p", "mp", "mf", "f", "ff", "fff", "ffff", "fffff",
            "fp", "sf", "sff", "sp", "spp", "sfz", "rfz", "fz");

    /**
     * Abbreviation character written after the direction mark, to the script it stands for.
     */
    public static final Map<String, String> ABBREVIATIONS = Map.of(
            ".", "staccato",
            ">", "accent",
            "-", "tenuto",
            "^", "marcato",
            "+", "stopped",
            "!", "staccatissimo",
            "_", "portato");

    private Scripts() {
    }

    public static Optional<String> expandAbbreviation(String abbreviation) {
        return Optional.ofNullable(ABBREVIATIONS.get(abbreviation));
    }

    public static Optional<String> abbreviationFor(String scriptName) {
        return ABBREVIATIONS.entrySet().stream()
                .filter(e -> e.getValue().equals(scriptName))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
