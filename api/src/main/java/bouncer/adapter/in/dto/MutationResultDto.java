package bouncer.adapter.in.dto;

/**
 * DTO reporting whether a mutation changed anything.
 */
public record MutationResultDto(boolean changed) {}
