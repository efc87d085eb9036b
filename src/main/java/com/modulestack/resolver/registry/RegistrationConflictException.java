package com.modulestack.resolver.registry;

import com.modulestack.resolver.model.ModuleIdentity;

import lombok.Getter;

/**
 * Raised when a variable that already has an identity is registered with a different one.
 */
@Getter
public class RegistrationConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String variableName;
    private final transient ModuleIdentity registered;
    private final transient ModuleIdentity rejected;

    public RegistrationConflictException(String variableName, ModuleIdentity registered, ModuleIdentity rejected) {
        super("Dependency " + variableName + " is already registered as " + registered
                + "; refusing to replace it with " + rejected);
        this.variableName = variableName;
        this.registered = registered;
        this.rejected = rejected;
    }
}
