package org.dxworks.wikiframe.error;

/**
 * Checked exception carrying an {@link MWError}.
 */
public class WikiframeException extends Exception {
    private final MWError error;

    public WikiframeException(MWError error) {
        super(error.describe());
        this.error = error;
    }

    public MWError getError() {
        return error;
    }
}
