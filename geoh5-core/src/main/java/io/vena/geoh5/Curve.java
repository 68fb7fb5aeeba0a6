package io.vena.geoh5;

import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * A polyline through its vertices, in order.
 */
public class Curve extends Points {
	public static final TypeIdentity TYPE_IDENTITY = TypeIdentity.of(
		UUID.fromString("6a057fdc-b355-11e3-95be-fd84a7ffcb88"),
		"Curve",
		"Curve");

	public static final EntityClass<ObjectType, Curve> CLASS = new EntityClass<>(Curve.class, TYPE_IDENTITY, Curve::new);

	protected Curve(Workspace workspace, UUID uid, String name, ObjectType entityType) {
		super(workspace, uid, name, entityType);
	}

	public static Curve create(Workspace workspace, String name, @Nullable Group parent) {
		return workspace.createObject(CLASS, name, parent);
	}

	/**
	 * @return the segments of the curve as pairs of vertex indices
	 */
	public int[][] cells() {
		int n = Math.max(0, nVertices() - 1);
		int[][] result = new int[n][];
		for (int i = 0; i < n; i++) {
			result[i] = new int[] { i, i + 1 };
		}
		return result;
	}

	public int nCells() {
		return Math.max(0, nVertices() - 1);
	}
}
