package io.datascope.event;

import io.datascope.Mode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A statement that has just been executed through a session.
 *
 * @param sql        statement text as sent to the driver
 * @param parameters bound parameters in order (may contain {@code null} elements)
 * @param mode       mode of the engine that executed it
 */
public record StatementEvent(String sql, List<Object> parameters, Mode mode) {
    public StatementEvent {
        Objects.requireNonNull(mode, "mode");
        parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
    }
}
