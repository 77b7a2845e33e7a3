package com.ewsmon.service.core.probe;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.io.ClassPathResource;

/**
 * SOAP envelope with {@code ${name}} placeholders and the function that supplies their values.
 *
 * <p>Placeholders are replaced in a single pass: substituted values are inserted literally, so configured accounts or
 * PINs containing {@code ${...}} or {@code $} never trigger further resolution. Placeholders without a value are
 * left as they are.
 */
final class PayloadTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_]+)}");

    private final String envelope;
    private final Function<ProbeContext, Map<String, String>> bindings;

    PayloadTemplate(String envelope, Function<ProbeContext, Map<String, String>> bindings) {
        this.envelope = envelope;
        this.bindings = bindings;
    }

    static PayloadTemplate load(ProbeType type, Function<ProbeContext, Map<String, String>> bindings) {
        ClassPathResource resource = new ClassPathResource(type.templateLocation());
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
            return new PayloadTemplate(text, bindings);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read SOAP template " + type.templateLocation(), ex);
        }
    }

    String render(ProbeContext context) {
        Map<String, String> values = bindings.apply(context);
        Matcher matcher = PLACEHOLDER.matcher(envelope);
        StringBuilder out = new StringBuilder(envelope.length() + 64);
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
