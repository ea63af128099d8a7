package org.dxworks.wikiframe.transform;

/**
 * Settings for the general transformations. None of the current passes is configurable; the
 * type exists so that passes share one signature with future configurable ones.
 */
public final class GeneralSettings {
    public static final GeneralSettings DEFAULT = new GeneralSettings();

    private GeneralSettings() {
    }
}
