package bouncer.adapter.in.dto;

/**
 * DTO for a load or save against policy storage.
 *
 * @param rules the number of rules read or written
 */
public record StorageResultDto(int rules) {}
