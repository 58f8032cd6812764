package io.fleetstate.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Options forwarded to each model destroyed on behalf of a dying controller. Fields are
 * nullable: an unset field leaves the decision to the model's own defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DestroyModelParams(
        Boolean destroyStorage,
        Boolean force,
        Long maxWaitMs
) {
    public static final int ARITY = 1;

    /** Older controller cleanups had no arguments and always destroyed storage. */
    public static final DestroyModelParams LEGACY = new DestroyModelParams(true, null, null);

    public static DestroyModelParams decode(CleanupArgs args) {
        args.requireAtMost(ARITY);
        if (args.isEmpty()) {
            return LEGACY;
        }
        DestroyModelParams decoded = args.decode(0, DestroyModelParams.class, "params");
        if (decoded == null) {
            throw new CleanupArgsException("unmarshalling cleanup arg 'params'");
        }
        return decoded;
    }

    public CleanupArgs toArgs() {
        return CleanupArgs.of(this);
    }
}
