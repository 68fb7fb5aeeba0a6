package io.vena.geoh5;

/**
 * The closed set of entity families a {@link Workspace} keeps in separate collections.
 */
public enum EntityKind {
	GROUP,
	OBJECT,
	DATA,
}
