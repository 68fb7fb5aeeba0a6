package io.vena.geoh5;

/**
 * What the values of a {@link Data} are attached to on their parent object.
 */
public enum DataAssociation {
	UNKNOWN,
	OBJECT,
	CUBE,
	GROUP,
	VERTEX,
	CELL,
	FACE,
}
