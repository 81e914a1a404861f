package io.opgraph.core.template;

import io.opgraph.core.util.Values;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Template resolver for `{{path}}` placeholders.
///
/// The path is trimmed and a leading `state.` marker is dropped, so `{{ state.user.name }}`
/// and `{{user.name}}` are equivalent. Strings are substituted verbatim, maps and lists as
/// JSON text, other values through `String.valueOf`.
public class PathTemplateResolver implements TemplateResolver {

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{\\{([^}]+)}}");
    private static final String STATE_PREFIX = "state.";

    @Override
    public String resolve(String template, VariableLookup lookup) {
        if (template == null) {
            return null;
        }
        if (!template.contains("{{")) {
            return template;
        }

        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String path = matcher.group(1).trim();
            if (path.startsWith(STATE_PREFIX)) {
                path = path.substring(STATE_PREFIX.length());
            }
            Optional<Object> value = path.isEmpty() ? Optional.empty() : lookup.lookup(path);
            String replacement = value.map(Values::stringify).orElse(matcher.group(0));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public Object resolveAll(Object value, VariableLookup lookup) {
        if (value instanceof String s) {
            return resolve(s, lookup);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(String.valueOf(k), resolveAll(v, lookup)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(v -> resolved.add(resolveAll(v, lookup)));
            return resolved;
        }
        return value;
    }
}
