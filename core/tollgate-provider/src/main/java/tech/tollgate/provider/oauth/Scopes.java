package tech.tollgate.provider.oauth;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Scope parameter handling. Scopes are case-sensitive and space separated on the wire.
 */
public final class Scopes {

    private Scopes() {
    }

    /**
     * Parse a space-delimited scope parameter, keeping first-seen order.
     * A null or blank value yields an empty set.
     */
    public static Set<String> parse(String scope) {
        if (scope == null || scope.isBlank()) {
            return Set.of();
        }
        Set<String> scopes = new LinkedHashSet<>();
        for (String token : scope.trim().split(" +")) {
            if (!token.isEmpty()) {
                scopes.add(token);
            }
        }
        return Collections.unmodifiableSet(scopes);
    }

    public static String format(Collection<String> scopes) {
        return String.join(" ", scopes);
    }

    public static boolean isSubset(Set<String> requested, Set<String> permitted) {
        return permitted.containsAll(requested);
    }
}
