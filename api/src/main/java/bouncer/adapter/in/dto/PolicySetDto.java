package bouncer.adapter.in.dto;

import java.util.List;

/**
 * DTO for the complete rule set.
 *
 * @param policies  policy rules in evaluation order
 * @param groupings role assignments of the default role definition
 */
public record PolicySetDto(List<List<String>> policies, List<List<String>> groupings) {}
