package org.dxworks.scoreframe.lilypond.lexer;

import java.util.Optional;

/**
 * Dutch note names: a step letter followed by is/es, isis/eses. The vowels a and e take the
 * contracted flats as, ases, es, eses.
 */
public final class NoteNames {

    private NoteNames() {
    }

    /**
     * Step and alteration in semitones.
     */
    public static final class Spelled {
        public final char step;
        public final int alter;

        Spelled(char step, int alter) {
            this.step = step;
            this.alter = alter;
        }
    }

    public static boolean isNoteName(String word) {
        return parse(word).isPresent();
    }

    public static Optional<Spelled> parse(String word) {
        if (word == null || word.isEmpty()) {
            return Optional.empty();
        }
        char step = word.charAt(0);
        if (step < 'a' || step > 'g') {
            return Optional.empty();
        }
        String suffix = word.substring(1);
        if ((step == 'a' || step == 'e') && suffix.startsWith("s") && !suffix.startsWith("is")) {
            // as, ases, es, eses: drop the leading e of the flat suffix
            suffix = "e" + suffix;
        }
        return switch (suffix) {
            case "" -> Optional.of(new Spelled(step, 0));
            case "is" -> Optional.of(new Spelled(step, 1));
            case "isis" -> Optional.of(new Spelled(step, 2));
            case "es" -> Optional.of(new Spelled(step, -1));
            case "eses" -> Optional.of(new Spelled(step, -2));
            default -> Optional.empty();
        };
    }

    /**
     * Canonical spelling: contracted forms for a and e flats.
     */
    public static String spell(char step, int alter) {
        String suffix = switch (alter) {
            case 1 -> "is";
            case 2 -> "isis";
            case -1 -> "es";
            case -2 -> "eses";
            case 0 -> "";
            default -> throw new IllegalArgumentException("Unsupported alteration " + alter);
        };
        if ((step == 'a' || step == 'e') && suffix.startsWith("es")) {
            suffix = suffix.substring(1);
        }
        return step + suffix;
    }
}
