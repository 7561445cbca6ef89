package org.dxworks.scoreframe.mei;

/**
 * Bowed tremolo wrapping one note or chord. {@code num} is the number of stem slashes.
 */
public class BTrem extends LayerElement {
    public LayerElement child;
    public Integer num;

    public BTrem() {
        super("bTrem");
    }
}
