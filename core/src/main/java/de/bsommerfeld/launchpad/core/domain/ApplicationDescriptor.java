package de.bsommerfeld.launchpad.core.domain;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Catalog entry describing something the launcher can start. Descriptors
 * are owned by the catalog and shared read-only by every instance launched
 * from them.
 *
 * @param id             stable catalog identifier
 * @param name           display name, also used as the window title hint
 * @param kind           strategy family that knows how to launch the target
 * @param target         executable path, URL, folder path or Android package
 * @param arguments      raw launch arguments, may be empty
 * @param description    free text shown in the catalog
 * @param category       grouping label, may be empty
 * @param singleInstance {@code true} if a second launch should switch to the
 *                       running instance instead of starting another one
 */
public record ApplicationDescriptor(
        String id,
        String name,
        ApplicationKind kind,
        String target,
        String arguments,
        String description,
        String category,
        boolean singleInstance) {

    public ApplicationDescriptor {
        checkArgument(id != null && !id.isBlank(), "descriptor id must not be blank");
        checkArgument(name != null && !name.isBlank(), "descriptor name must not be blank");
        checkArgument(kind != null, "descriptor kind must not be null");
        checkArgument(target != null && !target.isBlank(), "descriptor target must not be blank");
        arguments = arguments == null ? "" : arguments;
        description = description == null ? "" : description;
        category = category == null ? "" : category;
    }

    /**
     * Convenience constructor for catalog entries without description or
     * category. Folders may be opened several times, every other kind
     * defaults to a single instance.
     */
    public ApplicationDescriptor(String id, String name, ApplicationKind kind, String target, String arguments) {
        this(id, name, kind, target, arguments, "", "", kind != ApplicationKind.FOLDER);
    }

    public boolean hasArguments() {
        return !arguments.isBlank();
    }
}
