package org.javai.casebook.rules;

import java.util.Objects;

/**
 * Identifies the code a {@link RuleRegistry} belongs to: a module and a package within it.
 *
 * @param module The named module, or the empty string for the unnamed module
 * @param packageName The package, or the empty string for the default package
 */
public record ScopeKey(String module, String packageName) {

    public ScopeKey {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(packageName, "packageName must not be null");
    }

    /**
     * Derives the key for the code that declares the given class.
     */
    public static ScopeKey of(Class<?> type) {
        Objects.requireNonNull(type, "type must not be null");
        Module module = type.getModule();
        String moduleName = module.isNamed() ? module.getName() : "";
        return new ScopeKey(moduleName, type.getPackageName());
    }

    @Override
    public String toString() {
        return module.isEmpty() ? packageName : module + "/" + packageName;
    }
}
