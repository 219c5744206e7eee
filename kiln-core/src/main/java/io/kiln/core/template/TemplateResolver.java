package io.kiln.core.template;

import java.util.Map;
import java.util.Set;

/// Resolves `{placeholder}` variables in documentation strings. Pure utility, no dependencies.
public interface TemplateResolver {

    String resolve(String template, Map<String, Object> context);

    /// Returns the placeholder names referenced by a template, in order of appearance.
    Set<String> placeholders(String template);
}
