package io.opgraph.core.template;

/// Resolves `{{path}}` placeholders against a variable lookup. Pure utility, no dependencies.
public interface TemplateResolver {

    /// Replaces placeholders in a string. Unresolvable placeholders are left verbatim.
    String resolve(String template, VariableLookup lookup);

    /// Returns a new value with every string inside maps and lists resolved. The input is not
    /// modified.
    Object resolveAll(Object value, VariableLookup lookup);
}
