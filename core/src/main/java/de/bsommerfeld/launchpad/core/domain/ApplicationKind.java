package de.bsommerfeld.launchpad.core.domain;

/**
 * The kinds of application the launcher knows how to start. Each kind
 * carries a short prefix used when generating instance ids so that log
 * lines reveal the kind at a glance.
 */
public enum ApplicationKind {

    NATIVE_PROCESS("native"),
    WEB_PAGE("web"),
    BROWSER_APP("app"),
    FOLDER("folder"),
    ANDROID_PACKAGE("android");

    private final String idPrefix;

    ApplicationKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }
}
