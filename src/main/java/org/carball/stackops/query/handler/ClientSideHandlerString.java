package org.carball.stackops.query.handler;

import org.carball.stackops.exception.InvalidArgumentException;
import org.carball.stackops.model.preset.PresetKind;
import org.carball.stackops.model.preset.QueryPresetsString;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex matching and literal string membership.
 */
public class ClientSideHandlerString extends ClientSideHandler<QueryPresetsString> {

    public ClientSideHandlerString(PresetPropertyMappings propertyMappings) {
        super(propertyMappings);

        register(QueryPresetsString.MATCHES_REGEX, args -> {
            Pattern pattern = compile(args.requireString(FilterArguments.REGEX));
            // anchored at the start only
            return value -> value != null && pattern.matcher(value.toString()).lookingAt();
        });
        register(QueryPresetsString.ANY_IN, args -> {
            List<String> candidates = args.requireNonEmptyStringList(FilterArguments.VALUES);
            return value -> value instanceof String && candidates.contains(value);
        });
        register(QueryPresetsString.NOT_ANY_IN, args -> {
            List<String> candidates = args.requireNonEmptyStringList(FilterArguments.VALUES);
            return value -> !(value instanceof String && candidates.contains(value));
        });
    }

    @Override
    public PresetKind getKind() {
        return PresetKind.STRING;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidArgumentException("Invalid regex '" + regex + "': " + e.getDescription(), e);
        }
    }
}
