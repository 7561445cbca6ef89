package org.dxworks.scoreframe.mei;

import java.util.ArrayList;
import java.util.List;

/**
 * Traversal helpers over layer content.
 */
public final class LayerElements {

    private LayerElements() {
    }

    /**
     * Duration-bearing events (notes, chords, rests, spaces) in document order, looking through
     * tremolo and grace-group wrappers. Chord members are not listed separately.
     */
    public static List<LayerElement> events(List<LayerElement> elements) {
        List<LayerElement> result = new ArrayList<>();
        collectEvents(elements, result);
        return result;
    }

    public static List<LayerElement> events(Staff staff) {
        List<LayerElement> result = new ArrayList<>();
        for (Layer layer : staff.layers) {
            collectEvents(layer.children, result);
        }
        return result;
    }

    /**
     * Every element with an identity below the given elements, wrappers and chord members included.
     */
    public static List<MeiElement> descendants(List<LayerElement> elements) {
        List<MeiElement> result = new ArrayList<>();
        collectDescendants(elements, result);
        return result;
    }

    private static void collectEvents(List<LayerElement> elements, List<LayerElement> result) {
        for (LayerElement element : elements) {
            if (element instanceof BTrem bTrem) {
                if (bTrem.child != null) {
                    result.add(bTrem.child);
                }
            } else if (element instanceof GraceGrp graceGrp) {
                collectEvents(graceGrp.children, result);
            } else {
                result.add(element);
            }
        }
    }

    private static void collectDescendants(List<LayerElement> elements, List<MeiElement> result) {
        for (LayerElement element : elements) {
            result.add(element);
            if (element instanceof BTrem bTrem && bTrem.child != null) {
                collectDescendants(List.of(bTrem.child), result);
            } else if (element instanceof GraceGrp graceGrp) {
                collectDescendants(graceGrp.children, result);
            } else if (element instanceof Chord chord) {
                result.addAll(chord.notes);
            }
        }
    }
}
