package org.dxworks.scoreframe.lilypond;

import org.dxworks.scoreframe.ext.ExtensionStore;
import org.dxworks.scoreframe.ext.OrnamentInfo;
import org.dxworks.scoreframe.mei.ControlElement;
import org.dxworks.scoreframe.mei.Fermata;
import org.dxworks.scoreframe.mei.Mordent;
import org.dxworks.scoreframe.mei.Ornam;
import org.dxworks.scoreframe.mei.Trill;
import org.dxworks.scoreframe.mei.Turn;

import java.util.Optional;
import java.util.Set;

/**
 * Fixed mapping between LilyPond ornament scripts and MEI ornament elements. Scripts not listed here
 * are plain articulations.
 */
public final class OrnamentTable {

    private static final Set<String> ORNAM_TEXT = Set.of(
            "prallprall", "prallmordent", "upprall", "downprall", "upmordent", "downmordent",
            "pralldown", "prallup", "lineprall");

    private OrnamentTable() {
    }

    public static boolean isOrnament(String script) {
        return createElement(script).isPresent();
    }

    /**
     * A fresh element for the script, without identity or references.
     */
    public static Optional<ControlElement> createElement(String script) {
        switch (script) {
            case "trill":
                return Optional.of(new Trill());
            case "prall": {
                Mordent mordent = new Mordent();
                mordent.form = "upper";
                return Optional.of(mordent);
            }
            case "mordent": {
                Mordent mordent = new Mordent();
                mordent.form = "lower";
                return Optional.of(mordent);
            }
            case "turn": {
                Turn turn = new Turn();
                turn.form = "upper";
                return Optional.of(turn);
            }
            case "reverseturn": {
                Turn turn = new Turn();
                turn.form = "lower";
                return Optional.of(turn);
            }
            case "fermata":
                return Optional.of(fermata("curved"));
            case "shortfermata":
                return Optional.of(fermata("angular"));
            case "longfermata":
            case "verylongfermata":
                return Optional.of(fermata("square"));
            default:
                if (ORNAM_TEXT.contains(script)) {
                    Ornam ornam = new Ornam();
                    ornam.text = script;
                    return Optional.of(ornam);
                }
                return Optional.empty();
        }
    }

    /**
     * Scripts whose element alone does not say which one was written.
     */
    public static boolean isAmbiguous(String script) {
        return "verylongfermata".equals(script);
    }

    /**
     * The script an ornament element stands for, or empty when the element is not an ornament.
     */
    public static Optional<String> scriptName(ControlElement element, ExtensionStore store) {
        if (element.xmlId != null) {
            Optional<OrnamentInfo> info = store.ornament(element.xmlId);
            if (info.isPresent()) {
                return Optional.of(info.get().name);
            }
        }
        if (element instanceof Trill) {
            return Optional.of("trill");
        }
        if (element instanceof Mordent mordent) {
            return Optional.of("upper".equals(mordent.form) ? "prall" : "mordent");
        }
        if (element instanceof Turn turn) {
            return Optional.of("lower".equals(turn.form) ? "reverseturn" : "turn");
        }
        if (element instanceof Fermata fermata) {
            if ("angular".equals(fermata.shape)) {
                return Optional.of("shortfermata");
            }
            return Optional.of("square".equals(fermata.shape) ? "longfermata" : "fermata");
        }
        if (element instanceof Ornam ornam) {
            return Optional.ofNullable(ornam.text);
        }
        return Optional.empty();
    }

    private static Fermata fermata(String shape) {
        Fermata fermata = new Fermata();
        fermata.shape = shape;
        return fermata;
    }
}
