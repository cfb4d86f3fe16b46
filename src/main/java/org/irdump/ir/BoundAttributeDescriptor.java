package org.irdump.ir;

/**
 * Describes a tag helper property that an attribute is bound to.
 *
 * @param name The property name on the tag helper type.
 * @param typeName The CLR type name of the property.
 * @param displayName The name shown in tooling and IR dumps, e.g. {@code string InputTagHelper.Value}.
 */
public record BoundAttributeDescriptor(String name, String typeName, String displayName) {}
