package io.fleetstate.cleanup;

import io.fleetstate.state.StateException;
import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Failures a force-mode handler stepped over. A handler that returns diagnostics has
 * succeeded; the entries only say what it had to ignore to get there.
 */
public final class Diagnostics {
    private final List<String> warnings = new ArrayList<>();

    public static Diagnostics none() {
        return new Diagnostics();
    }

    /**
     * Logs the message at WARN and keeps it. Throwable arguments are rendered by message.
     */
    public void warn(Logger log, String format, Object... args) {
        Object[] rendered = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
            rendered[i] = args[i] instanceof Throwable ? describe((Throwable) args[i]) : args[i];
        }
        String message = MessageFormatter.arrayFormat(format, rendered).getMessage();
        log.warn(message);
        warnings.add(message);
    }

    /**
     * Rethrows {@code failure} unless {@code force} is set, in which case it is recorded and
     * the caller carries on.
     */
    public void tolerate(boolean force, StateException failure, Logger log, String format, Object... args) {
        if (!force) {
            throw failure;
        }
        warn(log, format, args);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int size() {
        return warnings.size();
    }

    private static String describe(Throwable t) {
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    @Override
    public String toString() {
        return warnings.toString();
    }
}
