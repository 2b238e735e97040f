package tech.rolesync.sdk.dto;

/**
 * Application-level sign-in experience (branding).
 */
public record SignInExperience(
    String displayName
) {}
