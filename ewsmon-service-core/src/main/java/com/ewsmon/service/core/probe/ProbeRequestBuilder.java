package com.ewsmon.service.core.probe;

import com.ewsmon.model.Target;
import com.ewsmon.service.core.config.EwsmonProperties;
import com.ewsmon.service.core.config.EwsmonProperties.EnvironmentCredentials;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link Target} into the SOAP request for its operation.
 *
 * <p>Each supported {@link ProbeType} maps to one template plus a binding function; the environment of the target
 * (production or certification) decides which account numbers and test identifiers get substituted. Targets whose
 * type has no template yield an empty result rather than an error.
 */
@Component
@Slf4j
public class ProbeRequestBuilder {

    static final String CONTENT_TYPE_HEADER = "Content-Type";
    static final String SOAP_ACTION_HEADER = "SOAPAction";
    static final String SOAP_CONTENT_TYPE = "text/xml;charset=UTF-8";

    private final EwsmonProperties properties;
    private final Map<ProbeType, PayloadTemplate> templates;

    @Autowired
    public ProbeRequestBuilder(EwsmonProperties properties) {
        this(properties, loadTemplates());
    }

    ProbeRequestBuilder(EwsmonProperties properties, Map<ProbeType, PayloadTemplate> templates) {
        this.properties = properties;
        this.templates = templates;
    }

    public Optional<ProbeRequest> build(Target target, LocalDate today) {
        ProbeType type = ProbeType.fromTag(target.apiType());
        PayloadTemplate template = templates.get(type);
        if (template == null) {
            log.debug("No payload template for target={} apiType={}", target.name(), target.apiType());
            return Optional.empty();
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(CONTENT_TYPE_HEADER, SOAP_CONTENT_TYPE);
        if (target.hasSoapAction()) {
            headers.put(SOAP_ACTION_HEADER, target.soapAction());
        }

        EnvironmentCredentials credentials = properties.getCredentials().forEnvironment(target.environment());
        String body = template.render(new ProbeContext(today, credentials));
        return Optional.of(new ProbeRequest(body, headers));
    }

    static Map<ProbeType, PayloadTemplate> loadTemplates() {
        Map<ProbeType, Function<ProbeContext, Map<String, String>>> bindings = new EnumMap<>(ProbeType.class);
        bindings.put(ProbeType.VALIDATE, ctx -> Map.of("account", ctx.credentials().getAccount()));
        bindings.put(ProbeType.TRACK, ctx -> Map.of("pin", ctx.credentials().getTrackPin()));
        bindings.put(ProbeType.FREIGHT_TRACK, ctx -> Map.of("pin", ctx.credentials().getFreightTrackPin()));
        bindings.put(
                ProbeType.FREIGHT_ESTIMATE, ctx -> Map.of("account", ctx.credentials().getFreightAccount()));
        bindings.put(ProbeType.LOCATE, ctx -> Map.of());
        bindings.put(ProbeType.ESTIMATE, ctx -> Map.of("account", ctx.credentials().getAccount()));
        bindings.put(
                ProbeType.PICKUP,
                ctx -> Map.of("account", ctx.credentials().getAccount(), "date", ctx.isoDate()));
        bindings.put(ProbeType.SERVICE_AVAILABILITY, ctx -> Map.of());
        bindings.put(
                ProbeType.SHIP_TRACK,
                ctx -> Map.of(
                        "trackingId", ctx.credentials().getShiptrackId(),
                        "account", ctx.credentials().getAccount()));
        bindings.put(ProbeType.RETURN, ctx -> Map.of("account", ctx.credentials().getAccount()));

        Map<ProbeType, PayloadTemplate> loaded = new EnumMap<>(ProbeType.class);
        bindings.forEach((type, binding) -> loaded.put(type, PayloadTemplate.load(type, binding)));
        return loaded;
    }
}
