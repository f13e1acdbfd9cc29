package com.docfusion.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Facts about one declaration as seen on one platform.
 *
 * @param documentation documentation text, or {@code null} when undocumented
 * @param visibility declared visibility
 * @param location source location, or {@code null} when unknown
 * @param annotations annotation names in declaration order
 * @param deprecated whether the declaration is deprecated on this platform
 * @param markers free-form tags appended by transformers, in the order they were added
 * @param supertypes qualified names of the extended and implemented types, in declaration order
 */
public record PlatformFacts(
    String documentation,
    Visibility visibility,
    SourceLocation location,
    List<String> annotations,
    boolean deprecated,
    List<String> markers,
    List<String> supertypes
) {
    /**
     * Compact constructor with validation.
     */
    public PlatformFacts {
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
        markers = markers == null ? List.of() : List.copyOf(markers);
        supertypes = supertypes == null ? List.of() : List.copyOf(supertypes);
    }

    /**
     * Facts carrying nothing but public visibility.
     *
     * @return empty facts
     */
    public static PlatformFacts empty() {
        return new PlatformFacts(null, Visibility.PUBLIC, null, List.of(), false, List.of(), List.of());
    }

    /**
     * Facts with documentation text and default values otherwise.
     *
     * @param documentation documentation text
     * @return facts
     */
    public static PlatformFacts documented(String documentation) {
        return new PlatformFacts(documentation, Visibility.PUBLIC, null, List.of(), false, List.of(), List.of());
    }

    /**
     * Returns true if non-blank documentation text is present.
     *
     * @return true if documented
     */
    public boolean hasDocumentation() {
        return documentation != null && !documentation.isBlank();
    }

    /**
     * Returns a copy with the given marker appended.
     *
     * @param marker marker to append
     * @return new facts
     */
    public PlatformFacts withMarker(String marker) {
        List<String> appended = new ArrayList<>(markers);
        appended.add(marker);
        return new PlatformFacts(documentation, visibility, location, annotations, deprecated, appended, supertypes);
    }

    /**
     * Returns a copy with the given supertypes.
     *
     * @param newSupertypes qualified supertype names
     * @return new facts
     */
    public PlatformFacts withSupertypes(List<String> newSupertypes) {
        return new PlatformFacts(documentation, visibility, location, annotations, deprecated, markers, newSupertypes);
    }
}
