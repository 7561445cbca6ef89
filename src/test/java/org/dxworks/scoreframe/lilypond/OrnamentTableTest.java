package org.dxworks.scoreframe.lilypond;

import org.dxworks.scoreframe.ext.ExtensionStore;
import org.dxworks.scoreframe.ext.OrnamentInfo;
import org.dxworks.scoreframe.mei.ControlElement;
import org.dxworks.scoreframe.mei.Dynam;
import org.dxworks.scoreframe.mei.Fermata;
import org.dxworks.scoreframe.mei.Mordent;
import org.dxworks.scoreframe.mei.Ornam;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OrnamentTableTest {

    private final ExtensionStore store = new ExtensionStore();

    @ParameterizedTest
    @ValueSource(strings = {"trill", "prall", "mordent", "turn", "reverseturn", "fermata", "shortfermata",
            "longfermata", "prallprall", "upmordent", "lineprall"})
    void unambiguousScriptsAreRecoveredFromTheElementAlone(String script) {
        ControlElement element = OrnamentTable.createElement(script).orElseThrow();

        assertFalse(OrnamentTable.isAmbiguous(script));
        assertEquals(script, OrnamentTable.scriptName(element, store).orElseThrow());
    }

    @Test
    void veryLongFermataNeedsItsStoredName() {
        Fermata fermata = (Fermata) OrnamentTable.createElement("verylongfermata").orElseThrow();
        fermata.xmlId = "f1";

        assertTrue(OrnamentTable.isAmbiguous("verylongfermata"));
        assertEquals("square", fermata.shape);
        assertEquals("longfermata", OrnamentTable.scriptName(fermata, store).orElseThrow());

        store.insert("f1", new OrnamentInfo("verylongfermata"));
        assertEquals("verylongfermata", OrnamentTable.scriptName(fermata, store).orElseThrow());
    }

    @Test
    void mordentFormsFollowTheScript() {
        assertEquals("upper", ((Mordent) OrnamentTable.createElement("prall").orElseThrow()).form);
        assertEquals("lower", ((Mordent) OrnamentTable.createElement("mordent").orElseThrow()).form);
        assertEquals("downprall", ((Ornam) OrnamentTable.createElement("downprall").orElseThrow()).text);
    }

    @Test
    void articulationsAreNotOrnaments() {
        assertFalse(OrnamentTable.isOrnament("staccato"));
        assertFalse(OrnamentTable.isOrnament("upbow"));
        assertTrue(OrnamentTable.isOrnament("turn"));
        assertTrue(OrnamentTable.scriptName(new Dynam(), store).isEmpty());
        assertTrue(OrnamentTable.scriptName(new Ornam(), store).isEmpty());
    }
}
