package bouncer.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for an explicit decision check.
 *
 * @param values request values in the order of the model's request definition
 */
public record DecisionRequest(@NotNull @NotEmpty List<@NotNull String> values) {}
