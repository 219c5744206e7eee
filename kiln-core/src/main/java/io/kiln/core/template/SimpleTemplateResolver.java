package io.kiln.core.template;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Simple template resolver using regex.
///
/// Unknown placeholders resolve to the empty string; callers that must reject
/// them check {@link #placeholders} first.
public class SimpleTemplateResolver implements TemplateResolver {

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{([^{}]+)}");

    @Override
    public String resolve(String template, Map<String, Object> context) {
        if (template == null) {
            return "";
        }

        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            Object value = context.get(matcher.group(1));
            String replacement = value != null ? value.toString() : "";
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
