package org.dxworks.scoreframe.lilypond.importer;

import org.dxworks.scoreframe.ext.ExtensionStore;
import org.dxworks.scoreframe.mei.MeiDocument;

/**
 * The common tree together with the extension entries that complete it.
 */
public class ImportedScore {
    public final MeiDocument document;
    public final ExtensionStore store;

    public ImportedScore(MeiDocument document, ExtensionStore store) {
        this.document = document;
        this.store = store;
    }
}
