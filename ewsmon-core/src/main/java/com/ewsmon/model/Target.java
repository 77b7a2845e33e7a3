package com.ewsmon.model;

import java.util.Objects;

/**
 * A monitored SOAP endpoint.
 *
 * <p>Rows are owned by the admin surface; the probing engine only reads a snapshot of the enabled ones per cycle.
 *
 * @param id         primary key of {@code api_target}
 * @param name       unique display name, used in alert titles
 * @param url        endpoint URL the probe posts to
 * @param soapAction value for the {@code SOAPAction} header, may be {@code null}
 * @param apiType    raw protocol tag as stored (validate, track, ...)
 * @param enabled    whether the target takes part in probe cycles
 */
public record Target(long id, String name, String url, String soapAction, String apiType, boolean enabled) {

    public Target {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
    }

    public Environment environment() {
        return Environment.fromUrl(url);
    }

    public boolean hasSoapAction() {
        return soapAction != null && !soapAction.isBlank();
    }
}
