package tech.rolesync.sdk.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A tenant-level role. {@code type} is {@code User} or {@code MachineToMachine}.
 */
public record Role(
    String id,
    String name,
    String description,
    String type,
    @JsonProperty("isDefault") boolean isDefault
) {}
