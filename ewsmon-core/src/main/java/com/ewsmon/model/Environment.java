package com.ewsmon.model;

/** Deployment environment of a probed endpoint, derived from its host. */
public enum Environment {
    PROD("PROD"),
    UAT("UAT");

    static final String UAT_HOST_MARKER = "://certwebservices.purolator.com";

    private final String label;

    Environment(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Certification hosts are UAT; anything else, including a missing URL, is production. */
    public static Environment fromUrl(String url) {
        if (url != null && url.contains(UAT_HOST_MARKER)) {
            return UAT;
        }
        return PROD;
    }
}
