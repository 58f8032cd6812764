package io.fleetstate.state;

/**
 * Charm reference of the form {@code schema:[~user/]name[-revision]}.
 *
 * @param revision -1 when the URL carries no revision
 */
public record CharmUrl(String schema, String user, String name, int revision) {

    public static CharmUrl parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("charm URL must not be blank");
        }
        String value = raw.trim();
        int colon = value.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("charm URL has no schema: \"" + raw + "\"");
        }
        String schema = value.substring(0, colon);
        if (!"cs".equals(schema) && !"local".equals(schema)) {
            throw new IllegalArgumentException("charm URL has invalid schema: \"" + raw + "\"");
        }
        String rest = value.substring(colon + 1);
        String user = null;
        if (rest.startsWith("~")) {
            int slash = rest.indexOf('/');
            if (slash < 2) {
                throw new IllegalArgumentException("charm URL has invalid user: \"" + raw + "\"");
            }
            user = rest.substring(1, slash);
            rest = rest.substring(slash + 1);
        }
        if (rest.contains("/")) {
            rest = rest.substring(rest.lastIndexOf('/') + 1);
        }
        int revision = -1;
        int dash = rest.lastIndexOf('-');
        if (dash > 0 && isDigits(rest.substring(dash + 1))) {
            revision = Integer.parseInt(rest.substring(dash + 1));
            rest = rest.substring(0, dash);
        }
        if (rest.isEmpty() || !Character.isLetter(rest.charAt(0))) {
            throw new IllegalArgumentException("charm URL has invalid charm name: \"" + raw + "\"");
        }
        return new CharmUrl(schema, user, rest, revision);
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(schema).append(':');
        if (user != null) {
            sb.append('~').append(user).append('/');
        }
        sb.append(name);
        if (revision >= 0) {
            sb.append('-').append(revision);
        }
        return sb.toString();
    }
}
